/**
 * Spring configuration for the decoder.
 *
 * <p>{@link com.phillippitts.bes3t.config.DecoderConfig} turns the validated
 * {@link com.phillippitts.bes3t.config.properties.DecoderProperties} into a
 * {@link com.phillippitts.bes3t.service.DecoderSettings} and builds the shared
 * {@link com.phillippitts.bes3t.service.archive.ArchiveParser}. Invalid property values fail
 * application startup through Bean Validation.
 */
package com.phillippitts.bes3t.config;
