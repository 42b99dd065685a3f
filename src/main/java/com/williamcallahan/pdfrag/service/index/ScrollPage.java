package com.williamcallahan.pdfrag.service.index;

import java.util.List;

/**
 * One page of stored points.
 *
 * @param points stored chunks with their vectors
 * @param nextOffset offset of the next page, null when this is the last one
 */
public record ScrollPage(List<IndexedPoint> points, String nextOffset) {
    public ScrollPage {
        points = points == null ? List.of() : List.copyOf(points);
    }

    public boolean hasNext() {
        return nextOffset != null;
    }
}
