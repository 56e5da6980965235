/**
 * Framework-neutral core of restfn.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.restfn.core.Router} (registration and dispatch)</li>
 *   <li>{@link io.restfn.core.Protocol} and its JSON implementation {@link io.restfn.core.JsonProtocol}</li>
 *   <li>{@link io.restfn.core.ErrorResponse}, {@link io.restfn.core.StatusCode} and {@link io.restfn.core.Reply},
 *       the values handlers throw and return</li>
 * </ul>
 *
 * <p>Server integrations adapt {@link io.restfn.core.ServerRequest} and
 * {@link io.restfn.core.ServerResponse} to their HTTP runtimes.
 */
package io.restfn.core;
