/**
 * Registration-time handler analysis and the per-route dispatchers it produces.
 */
package io.restfn.core.binding;
