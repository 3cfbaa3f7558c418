/**
 * Root package for SheetUnify.
 *
 * <p>
 * Contains the Spring Boot entry point that reads the command-line arguments and runs
 * {@link io.github.yok.sheetunify.core.SheetPipeline}.
 * </p>
 */
package io.github.yok.sheetunify;
