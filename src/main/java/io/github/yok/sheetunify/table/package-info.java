/**
 * In-memory table model: untyped cells, raw sheets, the unified master table and the column type
 * map.
 */
package io.github.yok.sheetunify.table;
