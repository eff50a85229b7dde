/**
 * Low-level helpers shared by the metadata model and its codecs.
 *
 * <p>{@link io.portmeta.utils.PrimitiveSlots} packs boxed primitives into 64-bit slots.
 */
package io.portmeta.utils;
