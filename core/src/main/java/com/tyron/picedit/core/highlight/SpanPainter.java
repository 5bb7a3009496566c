package com.tyron.picedit.core.highlight;

import com.tyron.picedit.api.editor.HighlightSpan;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Paints categories onto character ranges, keeping the painted segments disjoint.
 * All paints are clipped to {@code [clipStart, clipEnd)}. Not thread-safe; one instance
 * lives for a single highlight pass.
 */
final class SpanPainter {

    private record Segment(int start, int end, String category) {
    }

    private final int clipStart;
    private final int clipEnd;
    private final TreeMap<Integer, Segment> segments = new TreeMap<>();

    SpanPainter(int clipStart, int clipEnd) {
        this.clipStart = clipStart;
        this.clipEnd = clipEnd;
    }

    /**
     * Replaces whatever is painted under the range.
     */
    void paintOver(int start, int end, String category) {
        int s = Math.max(start, clipStart);
        int e = Math.min(end, clipEnd);
        if (s >= e) return;

        // segment starting before s may stick into the range
        Map.Entry<Integer, Segment> before = segments.lowerEntry(s);
        if (before != null && before.getValue().end() > s) {
            Segment b = before.getValue();
            segments.put(b.start(), new Segment(b.start(), s, b.category()));
            if (b.end() > e) {
                segments.put(e, new Segment(e, b.end(), b.category()));
            }
        }

        NavigableMap<Integer, Segment> inside = segments.subMap(s, true, e, false);
        Segment tail = null;
        for (Iterator<Segment> it = inside.values().iterator(); it.hasNext(); ) {
            Segment seg = it.next();
            if (seg.end() > e) {
                tail = new Segment(e, seg.end(), seg.category());
            }
            it.remove();
        }
        if (tail != null) {
            segments.put(tail.start(), tail);
        }
        segments.put(s, new Segment(s, e, category));
    }

    /**
     * Paints only the characters of the range that nothing has painted yet.
     */
    void paintGaps(int start, int end, String category) {
        int s = Math.max(start, clipStart);
        int e = Math.min(end, clipEnd);
        if (s >= e) return;

        int cursor = s;
        Map.Entry<Integer, Segment> before = segments.lowerEntry(s);
        if (before != null && before.getValue().end() > cursor) {
            cursor = before.getValue().end();
        }

        List<Segment> gaps = new ArrayList<>();
        for (Segment seg : segments.subMap(s, true, e, false).values()) {
            if (seg.start() > cursor) {
                gaps.add(new Segment(cursor, seg.start(), category));
            }
            cursor = Math.max(cursor, seg.end());
        }
        if (cursor < e) {
            gaps.add(new Segment(cursor, e, category));
        }
        for (Segment gap : gaps) {
            segments.put(gap.start(), gap);
        }
    }

    List<HighlightSpan> toSpans() {
        List<HighlightSpan> out = new ArrayList<>(segments.size());
        for (Segment seg : segments.values()) {
            out.add(new HighlightSpan(seg.start(), seg.end(), seg.category()));
        }
        return List.copyOf(out);
    }
}
