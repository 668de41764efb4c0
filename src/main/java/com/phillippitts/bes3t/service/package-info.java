/**
 * Decoder core. Each subpackage owns one stage of the pipeline:
 * <ul>
 *   <li>{@code metadata} - descriptor text and axis reconstruction</li>
 *   <li>{@code inference} - spectrum type and file-name parameters</li>
 *   <li>{@code layout} - per-dataset binary layout and size check</li>
 *   <li>{@code decode} - sample extraction and repair heuristics</li>
 *   <li>{@code normalize} - canonical axis units</li>
 *   <li>{@code quality} - multi-channel noise filtering</li>
 *   <li>{@code assembly} - 1-D/2-D spectrum construction</li>
 *   <li>{@code archive} - ZIP walking, pairing and the orchestrator</li>
 * </ul>
 *
 * <p>Everything below {@code archive.ArchiveParser} is Spring-free and stateless; only
 * {@code archive.ArchiveImportService}, {@code metrics} and {@code events} are Spring beans.
 */
package com.phillippitts.bes3t.service;
