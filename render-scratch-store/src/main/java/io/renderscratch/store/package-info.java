/**
 * Per-render scratch store.
 *
 * <p>{@link io.renderscratch.store.Scratch} is created by the rendering host once per render scope,
 * passed explicitly to whatever needs it, and dropped when the render completes.
 */
package io.renderscratch.store;
