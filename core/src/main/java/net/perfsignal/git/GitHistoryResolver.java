// This file is part of PerfSignal.
// Copyright (C) 2021  The PerfSignal Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.perfsignal.git;

import java.util.List;

import net.perfsignal.exceptions.GitHashResolutionException;

/**
 * Resolves the commits between two revisions.
 *
 * @since 1.0
 */
public interface GitHistoryResolver {

  /**
   * @param older The older revision, excluded from the result.
   * @param newer The newer revision, included in the result.
   * @return The commit hashes newest first.
   * @throws GitHashResolutionException if the range could not be resolved.
   */
  public List<String> resolve(final String older, final String newer)
      throws GitHashResolutionException;

}
