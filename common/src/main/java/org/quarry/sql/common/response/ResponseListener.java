/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.quarry.sql.common.response;

/**
 * Response listener for response post-processing callback. This is necessary because execution
 * engine may schedule and execute in different thread.
 *
 * @param <Response> response class
 */
public interface ResponseListener<Response> {

  /**
   * Handle successful response.
   *
   * @param response successful response
   */
  void onResponse(Response response);

  /**
   * Handle failed response.
   *
   * @param e exception captured
   */
  void onFailure(Exception e);
}
