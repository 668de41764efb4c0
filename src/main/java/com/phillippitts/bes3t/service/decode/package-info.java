/**
 * Binary sample extraction.
 *
 * <p>{@link com.phillippitts.bes3t.service.decode.BinaryDecoder} applies, in order: the
 * quad-interleaved fast path, per-dataset decoding, magnitude-based byte-order recovery,
 * interleaved-versus-block resolution scored by
 * {@link com.phillippitts.bes3t.service.decode.SignalStatistics#smoothness(double[], int)},
 * truncation to the point count and noisy-imaginary cleanup.
 */
package com.phillippitts.bes3t.service.decode;
