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
package net.perfsignal.exceptions;

/**
 * Thrown when the list of commits between two revisions could not be
 * determined.
 *
 * @since 1.0
 */
public class GitHashResolutionException extends Exception {
  private static final long serialVersionUID = -712368440986013207L;

  /** The older revision of the range. */
  private final String older;

  /** The newer revision of the range. */
  private final String newer;

  /**
   * Default ctor.
   * @param msg A non-null message to be given.
   * @param older The older revision.
   * @param newer The newer revision.
   * @param e An optional cause, may be null.
   */
  public GitHashResolutionException(final String msg,
                                    final String older,
                                    final String newer,
                                    final Throwable e) {
    super(msg, e);
    this.older = older;
    this.newer = newer;
  }

  /** @return The older revision of the range. */
  public String older() {
    return older;
  }

  /** @return The newer revision of the range. */
  public String newer() {
    return newer;
  }

}
