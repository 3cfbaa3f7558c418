/**
 * Utility package for SheetUnify.
 *
 * <p>
 * Provides stateless helpers used across the project: column name and file name normalization,
 * CSV writing and fail-fast error reporting for the command line.
 * </p>
 */
package io.github.yok.sheetunify.util;
