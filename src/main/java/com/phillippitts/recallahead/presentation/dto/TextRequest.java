package com.phillippitts.recallahead.presentation.dto;

/**
 * Body of input and search requests.
 *
 * @param text raw text of the input surface; may be null for a search of the latest text
 */
public record TextRequest(String text) {
}
