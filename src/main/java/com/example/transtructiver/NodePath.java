package com.example.transtructiver;

import com.google.common.base.Splitter;

import java.util.ArrayList;
import java.util.List;

/**
 * Dot-separated node coordinates. The root is {@code "0"}; each descent appends
 * {@code .<child-index>}. Two paths only address the same location across trees of
 * identical shape.
 */
public final class NodePath {

    public static final String ROOT = "0";

    private static final Splitter DOT = Splitter.on('.');

    private NodePath() {
    }

    public static String child(String parent, int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Child index must not be negative: " + index);
        }
        return parent + "." + index;
    }

    /**
     * Child indices of a path, excluding the leading root segment.
     */
    public static List<Integer> indices(String path) {
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("Path must not be empty");
        }
        List<String> segments = DOT.splitToList(path);
        if (!ROOT.equals(segments.get(0))) {
            throw new IllegalArgumentException("Path must start at the root \"0\": " + path);
        }
        List<Integer> result = new ArrayList<>(segments.size() - 1);
        for (String segment : segments.subList(1, segments.size())) {
            if (segment.isEmpty() || !segment.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("Malformed path segment '" + segment + "' in " + path);
            }
            result.add(Integer.parseInt(segment));
        }
        return result;
    }

    public static int depth(String path) {
        return indices(path).size();
    }
}
