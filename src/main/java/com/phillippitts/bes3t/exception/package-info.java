/**
 * Decoder exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.bes3t.exception.Bes3tException} - Base exception for all decoder errors</li>
 *   <li>{@link com.phillippitts.bes3t.exception.InvalidArchiveException} - Input is not a readable
 *       archive; propagated to the caller</li>
 *   <li>{@link com.phillippitts.bes3t.exception.InvalidDescriptorException} - Descriptor cannot
 *       describe a payload; pair skipped</li>
 *   <li>{@link com.phillippitts.bes3t.exception.LayoutMismatchException} - Declared and actual
 *       payload sizes differ; pair skipped</li>
 *   <li>{@link com.phillippitts.bes3t.exception.MissingDataFileException} - No paired data file;
 *       pair skipped</li>
 *   <li>{@link com.phillippitts.bes3t.exception.DecodeException} - Fast-path decode failure;
 *       standard decoding takes over</li>
 * </ul>
 *
 * <p>Only {@code InvalidArchiveException} ever reaches the caller of
 * {@link com.phillippitts.bes3t.service.archive.ArchiveParser#parse(byte[])}; everything else
 * degrades to fewer spectra plus a {@link com.phillippitts.bes3t.domain.ParseDiagnostic}.
 */
package com.phillippitts.bes3t.exception;
