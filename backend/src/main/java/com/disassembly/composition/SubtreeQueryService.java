package com.disassembly.composition;

import com.disassembly.config.CompositionProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Depth-bounded tree reads. The depth limit caps both what is fetched and what is returned.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SubtreeQueryService {

    private final CompositionArenaLoader arenaLoader;
    private final CompositionProperties properties;

    @Transactional(readOnly = true)
    public List<TreeView> getSubtree(RootSelector selector, int maxDepth) {
        requireDepth(maxDepth);
        CompositionArena arena = arenaLoader.load(selector, maxDepth);
        List<TreeView> views = arena.topIds().stream()
            .map(id -> toView(arena, id, 0, maxDepth))
            .toList();
        log.debug("Built {} tree views for {} at depth {}", views.size(), selector, maxDepth);
        return views;
    }

    /**
     * Convert loaded records into views, truncating children once {@code currentDepth == maxDepth}.
     */
    static TreeView toView(CompositionArena arena, Long id, int currentDepth, int maxDepth) {
        List<TreeView> components = currentDepth >= maxDepth
            ? List.of()
            : arena.childrenOf(id).stream()
                .filter(arena::contains)
                .map(childId -> toView(arena, childId, currentDepth + 1, maxDepth))
                .toList();
        return TreeView.of(arena.get(id), components);
    }

    private void requireDepth(int maxDepth) {
        int limit = properties.getQuery().getMaxDepth();
        if (maxDepth < 1 || maxDepth > limit) {
            throw new IllegalArgumentException("Depth must be between 1 and " + limit + ", got " + maxDepth);
        }
    }
}
