/**
 * Core processing package for SheetUnify.
 *
 * <p>
 * Implements the batch stages (workbook reading, sheet unification, type inference, type
 * coercion and CSV/JSON export) and {@link io.github.yok.sheetunify.core.SheetPipeline}, which
 * runs them in order.
 * </p>
 */
package io.github.yok.sheetunify.core;
