/**
 * Archive walking and orchestration.
 *
 * <p>{@link com.phillippitts.bes3t.service.archive.ArchiveParser} is the pure entry point;
 * {@link com.phillippitts.bes3t.service.archive.ArchiveImportService} adds size bounds,
 * log context, metrics and events for Spring callers.
 */
package com.phillippitts.bes3t.service.archive;
