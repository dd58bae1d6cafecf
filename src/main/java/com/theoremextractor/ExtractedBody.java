package com.theoremextractor;

/**
 * Body text of one canonical region, with its label pulled out.
 *
 * @param body flattened body, no {@code \label} left in it
 * @param label bound label, or {@code null} when absent or claimed by a later region
 * @param offset index of the region's {@code \begin} in the canonical text
 */
public record ExtractedBody(String body, String label, int offset) {
}
