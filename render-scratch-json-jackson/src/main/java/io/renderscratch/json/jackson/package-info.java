/**
 * Jackson binding for scratch values, registered as a {@code ScratchJsonCodec} service.
 */
package io.renderscratch.json.jackson;
