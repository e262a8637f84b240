/**
 * Value model for render scratch stores.
 *
 * <p>This module has no third-party dependencies. It contains only:
 * <ul>
 *   <li>The {@link io.renderscratch.core.ScratchValue} tagged variant</li>
 *   <li>Binary arithmetic over scratch values</li>
 *   <li>The {@link io.renderscratch.core.ScratchException} hierarchy</li>
 * </ul>
 *
 * <p>The store itself lives in {@code io.renderscratch.store}.
 */
package io.renderscratch.core;
