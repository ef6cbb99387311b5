package com.raditha.jarl.document;

/**
 * An R code chunk of an R Markdown or Quarto document.
 *
 * @param code        chunk body without the fences
 * @param startOffset offset of the body's first character in the document
 */
public record CodeChunk(String code, int startOffset) {
}
