package com.example.csvencoding;

import com.example.csvencoding.exception.UnexpectedShapeException;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Trie of one decoded row, keyed by header path segment. Every node maps a segment
 * either to the cell found under that path (a {@code String}) or to a nested tree.
 * <p>
 * {@code put("my.nested.struct", "henry")} on an empty tree yields
 * {@code {my={nested={struct=henry}}}}.
 */
@EqualsAndHashCode
public final class PathTree {

    public static final char SEPARATOR = '.';

    private final Map<String, Object> children = new LinkedHashMap<>();

    /**
     * Builds the tree of one row, pairing every header path with the cell at the same
     * position.
     */
    public static PathTree of(List<String> header, List<String> row) throws UnexpectedShapeException {
        if (header.size() != row.size()) {
            throw new UnexpectedShapeException("row has " + row.size() + " cells but the header has " + header.size() + " columns");
        }
        PathTree tree = new PathTree();
        for (int i = 0; i < header.size(); i++) {
            tree.put(header.get(i), row.get(i));
        }
        return tree;
    }

    public void put(String path, String value) throws UnexpectedShapeException {
        int dot = path.indexOf(SEPARATOR);
        if (dot < 0) {
            if (children.get(path) instanceof PathTree) {
                throw new UnexpectedShapeException("column `" + path + "` collides with nested columns of the same name");
            }
            children.put(path, value);
            return;
        }
        String head = path.substring(0, dot);
        Object child = children.get(head);
        if (child == null) {
            child = new PathTree();
            children.put(head, child);
        } else if (!(child instanceof PathTree)) {
            throw new UnexpectedShapeException("column `" + head + "` collides with nested column `" + path + "`");
        }
        try {
            ((PathTree) child).put(path.substring(dot + 1), value);
        } catch (UnexpectedShapeException e) {
            throw (UnexpectedShapeException) e.at(head);
        }
    }

    /**
     * @return the cell ({@code String}) or subtree ({@code PathTree}) under one segment,
     * or {@code null} if the row has no such column
     */
    public Object get(String segment) {
        return children.get(segment);
    }

    public Set<String> segments() {
        return Collections.unmodifiableSet(children.keySet());
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    /**
     * True when every cell below this node equals {@code value}.
     */
    public boolean allCellsEqual(String value) {
        for (Object child : children.values()) {
            if (child instanceof PathTree) {
                if (!((PathTree) child).allCellsEqual(value)) {
                    return false;
                }
            } else if (!value.equals(child)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return children.toString();
    }
}
