package com.spellcheck.data;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prefix tree over normalized words.
 *
 * <p>Nodes live in an arena and refer to each other by index; slot 0 is always the root.
 * Slots freed by {@link #remove(String)} are recycled by later inserts.
 * Not thread-safe.
 */
final class WordTrie {

    private static final int ROOT = 0;
    private static final int NO_PARENT = -1;

    private static final class Node {
        // sorted so that collection visits words in lexicographic order
        final TreeMap<Character, Integer> children = new TreeMap<>();
        final int parent;
        final char edge;
        boolean end;
        long freq;

        Node(int parent, char edge) {
            this.parent = parent;
            this.edge = edge;
        }
    }

    private record Frame(int node, String path) {}

    private final List<Node> nodes = new ArrayList<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();

    WordTrie() {
        nodes.add(new Node(NO_PARENT, '\0'));
    }

    void insert(String word, long frequency) {
        int cur = ROOT;
        for (int i = 0; i < word.length(); i++) {
            char ch = word.charAt(i);
            Integer next = nodes.get(cur).children.get(ch);
            if (next == null) {
                next = allocate(cur, ch);
                nodes.get(cur).children.put(ch, next);
            }
            cur = next;
        }
        Node node = nodes.get(cur);
        node.end = true;
        node.freq = frequency;
    }

    /**
     * Unmarks the terminal node of {@code word} and prunes the branch that no longer leads to any word.
     */
    boolean remove(String word) {
        int cur = find(word);
        if (cur == NO_PARENT || !nodes.get(cur).end) return false;
        Node terminal = nodes.get(cur);
        terminal.end = false;
        terminal.freq = 0L;

        while (cur != ROOT) {
            Node node = nodes.get(cur);
            if (node.end || !node.children.isEmpty()) break;
            int parent = node.parent;
            nodes.get(parent).children.remove(node.edge);
            release(cur);
            cur = parent;
        }
        return true;
    }

    boolean containsWord(String word) {
        int idx = find(word);
        return idx != NO_PARENT && nodes.get(idx).end;
    }

    long frequency(String word) {
        int idx = find(word);
        if (idx == NO_PARENT) return 0L;
        Node node = nodes.get(idx);
        return node.end ? node.freq : 0L;
    }

    /**
     * Collects up to {@code maxResults} words under {@code prefix}, depth first, in lexicographic order.
     * Returns an empty list when no path spells the prefix.
     */
    List<WordFrequency> collect(String prefix, int maxResults) {
        if (maxResults <= 0) return Collections.emptyList();
        int start = find(prefix);
        if (start == NO_PARENT) return Collections.emptyList();

        List<WordFrequency> out = new ArrayList<>();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start, prefix));
        while (!stack.isEmpty() && out.size() < maxResults) {
            Frame frame = stack.pop();
            Node node = nodes.get(frame.node());
            if (node.end) {
                out.add(new WordFrequency(frame.path(), node.freq));
            }
            // reverse push keeps the smallest child on top
            for (Map.Entry<Character, Integer> e : node.children.descendingMap().entrySet()) {
                stack.push(new Frame(e.getValue(), frame.path() + e.getKey()));
            }
        }
        return out;
    }

    void clear() {
        nodes.clear();
        freeSlots.clear();
        nodes.add(new Node(NO_PARENT, '\0'));
    }

    /** Live nodes, root included. */
    int nodeCount() {
        return nodes.size() - freeSlots.size();
    }

    private int find(String prefix) {
        int cur = ROOT;
        for (int i = 0; i < prefix.length(); i++) {
            Integer next = nodes.get(cur).children.get(prefix.charAt(i));
            if (next == null) return NO_PARENT;
            cur = next;
        }
        return cur;
    }

    private int allocate(int parent, char edge) {
        Node node = new Node(parent, edge);
        if (!freeSlots.isEmpty()) {
            int slot = freeSlots.pop();
            nodes.set(slot, node);
            return slot;
        }
        nodes.add(node);
        return nodes.size() - 1;
    }

    private void release(int slot) {
        nodes.set(slot, null);
        freeSlots.push(slot);
    }
}
