package fk.treestats.aggregation;

import fk.treestats.common.tree.SimpleTree;
import org.junit.Assert;
import org.junit.Test;

import static fk.treestats.aggregation.TestTrees.value;
import static fk.treestats.common.tree.SimpleTree.of;

public class ThresholdFilterTest {

    private static final double DELTA = 1e-9;

    private static DescendantTreeCount<SimpleTree<Integer>> countWithRatios(SimpleTree<Integer> root) {
        DescendantTreeCount<SimpleTree<Integer>> counted = DescendantTrees.countDescendantTree(root);
        DescendantTrees.calculateRatioToRoot(counted);
        return counted;
    }

    @Test
    public void testKeepsOnlyChildrenAboveThreshold() {
        DescendantTreeCount<SimpleTree<Integer>> counted = countWithRatios(TestTrees.wide());
        Assert.assertEquals(5, counted.getCount());
        Assert.assertEquals(3, counted.getChildrenCount());

        DescendantTreeCount<SimpleTree<Integer>> filtered = DescendantTrees.filterDescendantTree(counted, 0.3);

        Assert.assertEquals(5, filtered.getCount());
        Assert.assertEquals(1, filtered.getChildrenCount());
        Assert.assertEquals(1, filtered.getChildren().size());

        DescendantTreeCount<SimpleTree<Integer>> four = filtered.getChildren().get(0);
        Assert.assertEquals(Integer.valueOf(4), value(four));
        Assert.assertEquals(2, four.getCount());
        Assert.assertEquals(0.4, four.getRatioToRoot(), DELTA);
        Assert.assertEquals(0.4, four.getRatioToParent(), DELTA);
        // its only child is at 0.2 and goes too
        Assert.assertEquals(0, four.getChildrenCount());
        Assert.assertEquals(1, four.getBelowThresholdCount());

        Assert.assertEquals(3, filtered.getBelowThresholdCount());
        Assert.assertEquals(1.0, filtered.getRatioToRoot(), 0.0);
        Assert.assertEquals(1.0, filtered.getRatioToParent(), 0.0);
    }

    @Test
    public void testZeroThresholdKeepsEverything() {
        DescendantTreeCount<SimpleTree<Integer>> counted = countWithRatios(TestTrees.random(3, 300));

        DescendantTreeCount<SimpleTree<Integer>> filtered = DescendantTrees.filterDescendantTree(counted, 0);

        Assert.assertNotSame(counted, filtered);
        Assert.assertEquals(TestTrees.shape(counted), TestTrees.shape(filtered));
        Assert.assertEquals(300, TestTrees.size(filtered));
        for(DescendantTreeCount<SimpleTree<Integer>> node : DescendantTrees.collectAllNodes(filtered)) {
            Assert.assertEquals(0, node.getBelowThresholdCount());
        }
    }

    @Test
    public void testThresholdAboveOneKeepsOnlyRoot() {
        DescendantTreeCount<SimpleTree<Integer>> counted = countWithRatios(TestTrees.nested());

        DescendantTreeCount<SimpleTree<Integer>> filtered = DescendantTrees.filterDescendantTree(counted, 1.01);

        Assert.assertEquals(7, filtered.getCount());
        Assert.assertEquals(0, filtered.getChildrenCount());
        Assert.assertTrue(filtered.getChildren().isEmpty());
        Assert.assertEquals(counted.getCount() - 1, filtered.getBelowThresholdCount());
        Assert.assertSame(counted.getValue(), filtered.getValue());
    }

    @Test
    public void testPrunedWeightGoesToClosestKeptAncestor() {
        /*
          r -> a -> a1 -> a2
               b -> 6 leaves
         */
        SimpleTree<Integer> root = of(0,
            of(1,
                of(11,
                    of(111))),
            of(2, of(21), of(22), of(23), of(24), of(25), of(26)));
        DescendantTreeCount<SimpleTree<Integer>> counted = countWithRatios(root);
        Assert.assertEquals(11, counted.getCount());

        DescendantTreeCount<SimpleTree<Integer>> filtered = DescendantTrees.filterDescendantTree(counted, 0.2);

        Assert.assertEquals(2, filtered.getChildrenCount());
        DescendantTreeCount<SimpleTree<Integer>> a = filtered.getChildren().get(0);
        DescendantTreeCount<SimpleTree<Integer>> b = filtered.getChildren().get(1);
        Assert.assertEquals(Integer.valueOf(1), value(a));
        Assert.assertEquals(2, a.getBelowThresholdCount());
        Assert.assertEquals(0, a.getChildrenCount());
        Assert.assertEquals(Integer.valueOf(2), value(b));
        Assert.assertEquals(6, b.getBelowThresholdCount());
        Assert.assertEquals(8, filtered.getBelowThresholdCount());
    }

    @Test
    public void testKeptPlusPrunedAddsUpToRootCount() {
        for(double threshold : new double[]{0.0, 0.01, 0.05, 0.1, 0.25, 0.5, 0.9, 1.0, 2.0}) {
            DescendantTreeCount<SimpleTree<Integer>> counted = countWithRatios(TestTrees.random(11, 400));
            DescendantTreeCount<SimpleTree<Integer>> filtered = DescendantTrees.filterDescendantTree(counted, threshold);

            Assert.assertEquals(counted.getCount(), TestTrees.size(filtered) + filtered.getBelowThresholdCount());
            for(DescendantTreeCount<SimpleTree<Integer>> node : DescendantTrees.collectAllNodes(filtered)) {
                if(node != filtered) {
                    Assert.assertTrue(node.getRatioToRoot() >= threshold);
                }
                Assert.assertEquals(node.getChildren().size(), node.getChildrenCount());
            }
        }
    }

    @Test
    public void testSourceTreeIsNotModified() {
        DescendantTreeCount<SimpleTree<Integer>> counted = countWithRatios(TestTrees.nested());
        String before = TestTrees.shape(counted);

        DescendantTrees.filterDescendantTree(counted, 0.5);

        Assert.assertEquals(before, TestTrees.shape(counted));
        for(DescendantTreeCount<SimpleTree<Integer>> node : DescendantTrees.collectAllNodes(counted)) {
            Assert.assertEquals(0, node.getBelowThresholdCount());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNaNThreshold() {
        DescendantTrees.filterDescendantTree(countWithRatios(TestTrees.wide()), Double.NaN);
    }

    @Test
    public void testHigherThresholdsAreFilteredFromTheCountedTree() {
        DescendantTreeCount<SimpleTree<Integer>> counted = countWithRatios(TestTrees.random(17, 300));

        for(double threshold : new double[]{0.05, 0.2, 0.6}) {
            DescendantTreeCount<SimpleTree<Integer>> filtered = DescendantTrees.filterDescendantTree(counted, threshold);
            Assert.assertEquals(counted.getCount(), TestTrees.size(filtered) + filtered.getBelowThresholdCount());
        }

        // the counted tree carries no pruned weight, so it can be filtered any number of times
        for(DescendantTreeCount<SimpleTree<Integer>> node : DescendantTrees.collectAllNodes(counted)) {
            Assert.assertEquals(0, node.getBelowThresholdCount());
        }
    }
}
