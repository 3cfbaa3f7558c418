/**
 * Configuration model package for SheetUnify.
 *
 * <p>
 * Holds the values loaded from {@code application.yml} (or equivalent sources). Execution logic
 * lives in {@code core}.
 * </p>
 */
package io.github.yok.sheetunify.config;
