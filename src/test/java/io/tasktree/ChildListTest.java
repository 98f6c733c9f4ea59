package io.tasktree;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChildListTest {

    @Test
    void emptyListIsFinished() {
        ChildList children = new ChildList();

        assertTrue(children.isFinished());
        assertFalse(children.hasTransients());
        assertEquals(0, children.transientCount());
    }

    @Test
    void transientMembersAreCountedOnInsertAndDelete() {
        ChildList children = new ChildList();
        TreeNode background = transientNode();
        TreeNode regular = TreeNode.create();

        assertSame(children, children.insert(background));
        assertEquals(1, children.transientCount());
        assertTrue(children.hasTransients());
        assertTrue(children.isFinished());

        children.insert(regular);
        assertEquals(1, children.transientCount());
        assertFalse(children.isFinished());

        children.delete(regular);
        assertTrue(children.isFinished());

        assertSame(children, children.delete(background));
        assertEquals(0, children.transientCount());
        assertFalse(children.hasTransients());
        assertTrue(children.isFinished());
    }

    @Test
    void failedInsertLeavesCountUntouched() {
        ChildList children = new ChildList();
        final ChildList other = new ChildList();
        final TreeNode background = transientNode();
        children.insert(background);

        assertThrows(ListMembershipException.class, new org.junit.jupiter.api.function.Executable() {
            @Override
            public void execute() {
                other.insert(background);
            }
        });

        assertEquals(0, other.transientCount());
        assertEquals(1, children.transientCount());
    }

    @Test
    void transientCountTracksPresentTransientMembers() {
        Random random = new Random(7L);
        ChildList children = new ChildList();
        List<TreeNode> present = new ArrayList<TreeNode>();

        for (int step = 0; step < 300; step++) {
            if (present.isEmpty() || random.nextBoolean()) {
                TreeNode node = random.nextBoolean() ? transientNode() : TreeNode.create();
                children.insert(node);
                present.add(node);
            } else {
                children.delete(present.remove(random.nextInt(present.size())));
            }

            int expectedTransients = 0;
            for (TreeNode node : present) {
                if (node.isTransient()) {
                    expectedTransients++;
                }
            }
            assertEquals(expectedTransients, children.transientCount());
            assertEquals(expectedTransients == present.size(), children.isFinished());
        }
    }

    private static TreeNode transientNode() {
        return TreeNode.builder().withTransient(true).build();
    }
}
