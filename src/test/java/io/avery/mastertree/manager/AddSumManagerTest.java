package io.avery.mastertree.manager;

import io.avery.mastertree.MasterManager;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AddSumManagerTest {
    final AddSumManager manager = AddSumManager.INSTANCE;

    @Test
    void testApplyInfoScalesByLength() {
        AddSumManager.Info info = manager.makeInfo(null, 0, 4L, null, 0);
        AddSumManager.Info applied = manager.applyInfo(manager.makeInfo(info, 1, 1L, info, 1), 3, 10L);
        assertEquals(39L, applied.sum());
        assertEquals(39L, manager.infoToProd(applied));
    }

    @Test
    void testPropagateClearsPending() {
        AddSumManager.Info leaf = manager.makeInfo(null, 0, 2L, null, 0);
        Node node = new Node(manager.applyInfo(manager.makeInfo(leaf, 1, 3L, null, 0), 2, 5L), 3L, leaf);
        manager.propagate(node);
        assertEquals(8L, node.value);
        assertEquals(7L, node.left.sum());
        assertEquals(15L, node.info.sum());
        // A second flush is a no-op
        manager.propagate(node);
        assertEquals(8L, node.value);
        assertEquals(7L, node.left.sum());
    }

    // A single node with only a left child
    static class Node implements MasterManager.Propagation<Long, AddSumManager.Info> {
        AddSumManager.Info info;
        Long value;
        AddSumManager.Info left;

        Node(AddSumManager.Info info, Long value, AddSumManager.Info left) {
            this.info = info;
            this.value = value;
            this.left = left;
        }

        @Override public AddSumManager.Info info() { return info; }
        @Override public void setInfo(AddSumManager.Info info) { this.info = info; }
        @Override public Long value() { return value; }
        @Override public void setValue(Long value) { this.value = value; }
        @Override public AddSumManager.Info leftInfo() { return left; }
        @Override public int leftLength() { return 1; }
        @Override public void setLeftInfo(AddSumManager.Info info) { left = info; }
        @Override public AddSumManager.Info rightInfo() { return null; }
        @Override public int rightLength() { return 0; }
        @Override public void setRightInfo(AddSumManager.Info info) { throw new IllegalStateException("No right child"); }
    }
}
