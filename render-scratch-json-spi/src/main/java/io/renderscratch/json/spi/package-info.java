/**
 * JSON binding SPI for scratch values.
 *
 * <p>This module only defines the contract. Install an implementation module
 * (for example {@code render-scratch-json-jackson}) to get a working codec.
 */
package io.renderscratch.json.spi;
