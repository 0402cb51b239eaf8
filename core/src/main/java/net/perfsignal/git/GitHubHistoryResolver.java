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

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.apache.http.HttpHeaders;
import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.nio.client.CloseableHttpAsyncClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.Lists;

import net.perfsignal.exceptions.GitHashResolutionException;
import net.perfsignal.utils.JSON;
import net.perfsignal.utils.JSONException;

/**
 * Resolves revision ranges through the GitHub compare API. The API lists
 * commits oldest first so the result is reversed.
 *
 * @since 1.0
 */
public class GitHubHistoryResolver implements GitHistoryResolver {
  private static final Logger LOG = LoggerFactory.getLogger(
      GitHubHistoryResolver.class);

  /** The page size requested from the API. */
  public static final int PER_PAGE = 100;

  private final CloseableHttpAsyncClient client;
  private final String api;
  private final String token;

  /**
   * Default ctor.
   * @param client A non-null, started client.
   * @param api The repository API URL, e.g.
   * {@code https://api.github.com/repos/mongodb/mongo}.
   * @param token An optional OAuth token, may be null or empty.
   */
  public GitHubHistoryResolver(final CloseableHttpAsyncClient client,
                               final String api,
                               final String token) {
    Preconditions.checkNotNull(client, "Client cannot be null.");
    Preconditions.checkArgument(!Strings.isNullOrEmpty(api),
        "API URL cannot be null or empty.");
    this.client = client;
    this.api = api.endsWith("/") ? api.substring(0, api.length() - 1) : api;
    this.token = token;
  }

  @Override
  public List<String> resolve(final String older, final String newer)
      throws GitHashResolutionException {
    final HttpGet get = new HttpGet(url(older, newer));
    get.setHeader(HttpHeaders.ACCEPT, "application/vnd.github.v3+json");
    if (!Strings.isNullOrEmpty(token)) {
      get.setHeader(HttpHeaders.AUTHORIZATION, "token " + token);
    }

    final HttpResponse response;
    try {
      final Future<HttpResponse> future = client.execute(get, null);
      response = future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GitHashResolutionException("Interrupted calling " 
          + get.getURI(), older, newer, e);
    } catch (ExecutionException e) {
      throw new GitHashResolutionException("Failed calling " + get.getURI(),
          older, newer, e.getCause());
    }

    final String body;
    try {
      body = EntityUtils.toString(response.getEntity());
    } catch (IOException e) {
      throw new GitHashResolutionException("Failed reading the response of " 
          + get.getURI(), older, newer, e);
    }
    final int status = response.getStatusLine().getStatusCode();
    if (status != 200) {
      throw new GitHashResolutionException("Status " + status + " from " 
          + get.getURI() + ": " + body, older, newer, null);
    }

    final List<String> hashes = Lists.newArrayList();
    try {
      final JsonNode commits = JSON.parseToTree(body).get("commits");
      if (commits == null || !commits.isArray()) {
        throw new GitHashResolutionException("No commits in response from " 
            + get.getURI(), older, newer, null);
      }
      for (final JsonNode commit : commits) {
        final JsonNode sha = commit.get("sha");
        if (sha != null && sha.isTextual()) {
          hashes.add(sha.asText());
        }
      }
    } catch (IllegalArgumentException | JSONException e) {
      throw new GitHashResolutionException("Unparseable response from " 
          + get.getURI(), older, newer, e);
    }
    Collections.reverse(hashes);
    if (LOG.isDebugEnabled()) {
      LOG.debug("Resolved " + hashes.size() + " revisions from " + older 
          + " to " + newer + " via " + api);
    }
    return hashes;
  }

  /**
   * @param older The older revision.
   * @param newer The newer revision.
   * @return The compare URL.
   */
  String url(final String older, final String newer) {
    return api + "/compare/" + older + "..." + newer + "?per_page=" + PER_PAGE;
  }

  @Override
  public String toString() {
    return "GitHubHistoryResolver[" + api + "]";
  }
}
