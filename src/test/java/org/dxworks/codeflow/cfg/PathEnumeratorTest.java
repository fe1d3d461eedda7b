package org.dxworks.codeflow.cfg;

import org.dxworks.codeflow.model.Block;
import org.dxworks.codeflow.model.Cfg;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.codeflow.ast.StubNode.expression;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PathEnumeratorTest {

    @Test
    void diamond_yieldsBothRoutesInExitOrder() {
        Cfg cfg = diamond();

        List<List<Block>> paths = new PathEnumerator(10, 10).enumerate(cfg);

        assertEquals(List.of(List.of(1, 2, 4), List.of(1, 3, 4)), ids(paths));
    }

    @Test
    void cycle_isEnteredOncePerRoute() {
        Cfg cfg = new Cfg("t", null);
        Block guard = block(cfg, 1);
        Block body = block(cfg, 2);
        Block inner = block(cfg, 3);
        Block after = block(cfg, 4);
        cfg.setEntryBlock(guard);
        guard.addExit(body, "c");
        guard.addExit(after, "!(c)");
        body.addExit(inner, null);
        inner.addExit(body, "again");
        inner.addExit(after, null);
        cfg.addFinalBlock(after);

        List<List<Block>> paths = new PathEnumerator(10, 10).enumerate(cfg);

        assertEquals(List.of(List.of(1, 2, 3, 4), List.of(1, 4)), ids(paths));
    }

    @Test
    void sameBlock_mayAppearInSeveralRoutes() {
        List<List<Block>> paths = new PathEnumerator(10, 10).enumerate(diamond());

        assertTrue(paths.stream().allMatch(path -> path.get(path.size() - 1).getId() == 4));
    }

    @Test
    void pathCountBound_truncatesSilently() {
        List<List<Block>> paths = new PathEnumerator(10, 1).enumerate(diamond());

        assertEquals(List.of(List.of(1, 2, 4)), ids(paths));
    }

    @Test
    void depthBound_dropsRoutesThatAreTooLong() {
        Cfg cfg = new Cfg("t", null);
        Block a = block(cfg, 1);
        Block b = block(cfg, 2);
        Block c = block(cfg, 3);
        cfg.setEntryBlock(a);
        a.addExit(b, null);
        a.addExit(c, "short");
        b.addExit(c, null);

        List<List<Block>> paths = new PathEnumerator(2, 10).enumerate(cfg);

        assertEquals(List.of(List.of(1, 3)), ids(paths));
    }

    @Test
    void finalBlockWithExits_stillEndsTheRoute() {
        Cfg cfg = new Cfg("t", null);
        Block a = block(cfg, 1);
        Block b = block(cfg, 2);
        cfg.setEntryBlock(a);
        a.addExit(b, null);
        cfg.addFinalBlock(a);

        assertEquals(List.of(List.of(1)), ids(new PathEnumerator(10, 10).enumerate(cfg)));
    }

    @Test
    void bounds_mustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new PathEnumerator(0, 10));
    }

    private static Cfg diamond() {
        Cfg cfg = new Cfg("t", null);
        Block top = block(cfg, 1);
        Block left = block(cfg, 2);
        Block right = block(cfg, 3);
        Block bottom = block(cfg, 4);
        cfg.setEntryBlock(top);
        top.addExit(left, "c");
        top.addExit(right, "!(c)");
        left.addExit(bottom, null);
        right.addExit(bottom, null);
        cfg.addFinalBlock(bottom);
        return cfg;
    }

    private static Block block(Cfg cfg, int id) {
        Block block = new Block(id);
        block.addStatement(expression("s" + id, id));
        cfg.addBlock(block);
        return block;
    }

    private static List<List<Integer>> ids(List<List<Block>> paths) {
        return paths.stream()
                .map(path -> path.stream().map(Block::getId).collect(Collectors.toList()))
                .collect(Collectors.toList());
    }
}
