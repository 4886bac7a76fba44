package com.studioflow.orchestrator.provider;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic lyric timing: spreads the duration evenly over the
 * non-empty lines, then over the words of each line. The output shape is
 * the one a real aligner is expected to return, so consumers do not care
 * which one produced it.
 */
public final class TimedLyrics {

    private TimedLyrics() {}

    public static Map<String, Object> spread(String lyricsText, long durationMs, String language) {
        long duration = Math.max(1, durationMs);
        List<String> lines = new ArrayList<>();
        for (String raw : (lyricsText == null ? "" : lyricsText).split("\\R")) {
            String line = raw.strip();
            if (!line.isEmpty()) lines.add(line);
        }

        List<Map<String, Object>> segments = new ArrayList<>();
        if (!lines.isEmpty()) {
            int  n    = lines.size();
            long base = duration / n;
            long rem  = duration % n;
            long t    = 0;
            for (int i = 0; i < n; i++) {
                long start = t;
                long end   = Math.min(duration, t + base + (i < rem ? 1 : 0));
                t = end;
                segments.add(segment(lines.get(i), start, end));
            }
            // Rounding never leaves a gap at the end of the song.
            Map<String, Object> last = segments.get(segments.size() - 1);
            last.put("end_ms", duration);
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> words = (List<Map<String, Object>>) last.get("words");
            if (!words.isEmpty()) words.get(words.size() - 1).put("end_ms", duration);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("version", 1);
        out.put("language", language);
        out.put("segments", segments);
        return out;
    }

    private static Map<String, Object> segment(String line, long start, long end) {
        List<Map<String, Object>> words = new ArrayList<>();
        String[] tokens = line.split(" +");
        long span  = end - start;
        long wbase = Math.max(1, span / tokens.length);
        long wrem  = span - wbase * tokens.length;
        long wt    = start;
        for (int i = 0; i < tokens.length; i++) {
            long wstart = wt;
            long wend   = Math.min(end, wt + wbase + (i < wrem ? 1 : 0));
            wt = wend;
            Map<String, Object> word = new LinkedHashMap<>();
            word.put("w", tokens[i]);
            word.put("start_ms", wstart);
            word.put("end_ms", wend);
            words.add(word);
        }
        Map<String, Object> seg = new LinkedHashMap<>();
        seg.put("start_ms", start);
        seg.put("end_ms", end);
        seg.put("text", line);
        seg.put("words", words);
        return seg;
    }
}
