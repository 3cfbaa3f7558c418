/**
 * Exception types for SheetUnify.
 *
 * <p>
 * Every fatal condition of a run is a subclass of
 * {@link io.github.yok.sheetunify.exception.SheetUnifyException}. Column type coercion failures
 * are not exceptions; they are reported through {@code CoercionResult} and recovered locally.
 * </p>
 */
package io.github.yok.sheetunify.exception;
