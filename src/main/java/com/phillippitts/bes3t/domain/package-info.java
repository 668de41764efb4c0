/**
 * Immutable value types produced by the BES3T archive decoder.
 *
 * <p>Key types:
 * <ul>
 *   <li>{@link com.phillippitts.bes3t.domain.Metadata} - upper-cased key/value view of a descriptor
 *       with non-throwing typed accessors</li>
 *   <li>{@link com.phillippitts.bes3t.domain.Spectrum} - decoded spectrum, either
 *       {@link com.phillippitts.bes3t.domain.Spectrum1D} or {@link com.phillippitts.bes3t.domain.Spectrum2D}</li>
 *   <li>{@link com.phillippitts.bes3t.domain.ParseResult} - sample name, spectra and diagnostics for one archive</li>
 * </ul>
 *
 * <p>All instances are created fresh per decode call and share no state.
 */
package com.phillippitts.bes3t.domain;
