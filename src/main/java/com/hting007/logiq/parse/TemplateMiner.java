package com.hting007.logiq.parse;

import com.hting007.logiq.model.ParsedLine;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Online log template miner built on a bounded-depth prefix tree.
 *
 * <p>Each line is reduced to its message body, tokenized on whitespace, and every token
 * holding a standalone number is masked with {@link #WILDCARD}. The masked tokens then walk
 * the tree one level per token, preferring an exact child over a wildcard child. The first
 * level without a match grows a new node carrying the masked line as its template; a walk
 * that runs out of tokens or reaches {@code maxDepth} reuses the node it stopped on.
 * Assignments are never revisited: nodes are only added, never merged or rebalanced.
 *
 * <p>One instance is meant to be shared by every stream of the process so template ids stay
 * consistent. Tree updates take the write lock; {@link #getStats()} takes the read lock.
 */
@Log4j2
public class TemplateMiner {

    public static final String WILDCARD = "<*>";
    public static final int DEFAULT_MAX_DEPTH = 5;

    private static final Pattern NUMBER = Pattern.compile("\\b\\d+\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String SEGMENT_DELIMITER = "]";
    private static final int PREFIX_SEGMENTS = 2;

    private final int maxDepth;
    private final TemplateNode root = new TemplateNode(0);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final AtomicLong totalParsed = new AtomicLong();
    // guarded by lock
    private int templateNodes;

    public TemplateMiner() {
        this(DEFAULT_MAX_DEPTH);
    }

    public TemplateMiner(int maxDepth) {
        if (maxDepth <= 0) throw new IllegalArgumentException("maxDepth must be > 0");
        this.maxDepth = maxDepth;
    }

    /**
     * Mines one raw line. Blank input yields {@link ParsedLine#EMPTY}; nothing here throws
     * on malformed lines.
     */
    public ParsedLine parse(String rawLine) {
        if (rawLine == null) return ParsedLine.EMPTY;

        List<String> tokens = tokenize(extractMessage(rawLine));
        if (tokens.isEmpty()) {
            log.debug("Blank message, nothing to mine: '{}'", rawLine);
            return ParsedLine.EMPTY;
        }

        List<String> masked = mask(tokens);

        String template;
        lock.writeLock().lock();
        try {
            template = searchTree(masked).getTemplate();
        } finally {
            lock.writeLock().unlock();
        }
        totalParsed.incrementAndGet();

        List<String> parameters = extractParameters(tokens, tokenize(template));
        return new ParsedLine(TemplateIds.of(template), template, parameters);
    }

    /**
     * Keeps what follows the second {@code ]} of a {@code [ts] [LEVEL] message} line.
     * Lines with fewer segments are returned whole.
     */
    static String extractMessage(String rawLine) {
        String[] parts = rawLine.split(Pattern.quote(SEGMENT_DELIMITER), -1);
        if (parts.length > PREFIX_SEGMENTS) {
            return String.join(SEGMENT_DELIMITER,
                    Arrays.asList(parts).subList(PREFIX_SEGMENTS, parts.length)).trim();
        }
        return rawLine;
    }

    /** Splits on any Unicode white space; leading and trailing runs yield no token. */
    static List<String> tokenize(String message) {
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(message)) {
            if (!token.isEmpty()) tokens.add(token);
        }
        return tokens;
    }

    static List<String> mask(List<String> tokens) {
        List<String> masked = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            masked.add(NUMBER.matcher(token).find() ? WILDCARD : token);
        }
        return masked;
    }

    /**
     * Positional values where the template holds a wildcard, compared up to the shorter
     * of the two sequences.
     */
    static List<String> extractParameters(List<String> original, List<String> template) {
        List<String> params = new ArrayList<>();
        int n = Math.min(original.size(), template.size());
        for (int i = 0; i < n; i++) {
            if (WILDCARD.equals(template.get(i)) && !WILDCARD.equals(original.get(i))) {
                params.add(original.get(i));
            }
        }
        return params;
    }

    // caller holds the write lock
    private TemplateNode searchTree(List<String> masked) {
        TemplateNode node = root;
        int depth = 0;

        while (depth < masked.size() && depth < maxDepth) {
            String token = masked.get(depth);

            TemplateNode child = node.getChild(token);
            if (child == null) {
                child = node.getChild(WILDCARD);
            }
            if (child != null) {
                node = child;
                depth++;
                continue;
            }

            TemplateNode created = node.addChild(token, String.join(" ", masked));
            created.increment();
            templateNodes++;
            log.debug("New template node at depth {}: {}", created.getDepth(), created.getTemplate());
            return created;
        }

        // depth bound reached: the node's existing template is reused
        node.increment();
        return node;
    }

    /**
     * Occurrences per template text over the whole tree. Nodes sharing a template add up.
     * Diagnostic only: walks every node under the read lock.
     */
    public Map<String, Long> getStats() {
        Map<String, Long> stats = new HashMap<>();
        lock.readLock().lock();
        try {
            collectStats(root, stats);
        } finally {
            lock.readLock().unlock();
        }
        return Collections.unmodifiableMap(stats);
    }

    private void collectStats(TemplateNode node, Map<String, Long> stats) {
        if (node.hasTemplate()) {
            stats.merge(node.getTemplate(), node.getCount(), Long::sum);
        }
        for (TemplateNode child : node.childNodes()) {
            collectStats(child, stats);
        }
    }

    public long getTotalParsed() {
        return totalParsed.get();
    }

    /** Number of tree nodes that carry a template. */
    public int getTemplateNodeCount() {
        lock.readLock().lock();
        try {
            return templateNodes;
        } finally {
            lock.readLock().unlock();
        }
    }
}
