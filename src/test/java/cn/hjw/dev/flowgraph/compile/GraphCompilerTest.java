package cn.hjw.dev.flowgraph.compile;

import cn.hjw.dev.flowgraph.condition.Branch;
import cn.hjw.dev.flowgraph.config.GraphConfig;
import cn.hjw.dev.flowgraph.config.GraphConstants;
import cn.hjw.dev.flowgraph.config.NodeOptions;
import cn.hjw.dev.flowgraph.config.ValueType;
import cn.hjw.dev.flowgraph.engine.FlowGraphEngine;
import cn.hjw.dev.flowgraph.exception.ErrorKind;
import cn.hjw.dev.flowgraph.exception.FlowGraphException;
import cn.hjw.dev.flowgraph.processor.NodeProcessor;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 编译期校验测试
 * 验证：节点命名、边端点、类型标签、可达性
 */
public class GraphCompilerTest {

    private final NodeProcessor<Object, Object> identity = (input, cb) -> input;

    private static NodeOptions typed(ValueType inputType, ValueType outputType) {
        return NodeOptions.builder().inputType(inputType).outputType(outputType).build();
    }

    @Test
    public void testReservedNameRejected() {
        GraphConfig<Object, Object> config = new GraphConfig<>();

        FlowGraphException ex = Assertions.assertThrows(FlowGraphException.class,
                () -> config.addNode(GraphConstants.START, identity));

        Assertions.assertEquals(ErrorKind.INVALID_NODE_NAME, ex.getKind());
        Assertions.assertEquals("\"__START__\" is reserved.", ex.getMessage());
        Assertions.assertThrows(FlowGraphException.class, () -> config.addNode(GraphConstants.END, identity));
    }

    @Test
    public void testDuplicateNodeRejected() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity);

        FlowGraphException ex = Assertions.assertThrows(FlowGraphException.class, () -> config.addNode("a", identity));

        Assertions.assertEquals(ErrorKind.DUPLICATE_NODE, ex.getKind());
        Assertions.assertEquals(List.of("a"), ex.getNodeIds());
    }

    @Test
    public void testEdgeToUnknownNodeRejected() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity);

        FlowGraphException ex = Assertions.assertThrows(FlowGraphException.class, () -> config.addEdge("a", "ghost"));

        Assertions.assertEquals(ErrorKind.INVALID_EDGE, ex.getKind());
        Assertions.assertEquals("Node \"ghost\" does not exist.", ex.getMessage());
        Assertions.assertTrue(config.getEdges().isEmpty());
    }

    @Test
    public void testEntryAndFinishPointsMustExist() {
        GraphConfig<Object, Object> config = new GraphConfig<>();

        Assertions.assertEquals(ErrorKind.INVALID_NODE_NAME, Assertions.assertThrows(FlowGraphException.class,
                () -> config.setEntryPoint("ghost")).getKind());
        Assertions.assertEquals(ErrorKind.INVALID_NODE_NAME, Assertions.assertThrows(FlowGraphException.class,
                () -> config.setFinishPoint("ghost")).getKind());

        config.addNode("a", identity).setEntryPoint("a").setFinishPoint("a");
        Assertions.assertEquals(List.of("a"), List.copyOf(config.getEntryPoints()));
        Assertions.assertEquals(List.of("a"), List.copyOf(config.getFinishPoints()));
    }

    @Test
    public void testBranchTargetMustExist() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity);
        config.setEntryPoint("a");
        config.addBranch("a", "next", Branch.then("ghost"));

        FlowGraphException ex = Assertions.assertThrows(FlowGraphException.class, config::compile);

        Assertions.assertEquals(ErrorKind.INVALID_EDGE, ex.getKind());
        Assertions.assertEquals(List.of("ghost"), ex.getNodeIds());
    }

    @Test
    public void testUnreachableNodesReportedTogether() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity).addNode("orphan1", identity).addNode("orphan2", identity);
        config.setEntryPoint("a");
        config.setFinishPoint("a");

        FlowGraphException ex = Assertions.assertThrows(FlowGraphException.class, config::compile);

        Assertions.assertEquals(ErrorKind.UNREACHABLE_NODE, ex.getKind());
        Assertions.assertEquals(List.of("orphan1", "orphan2"), ex.getNodeIds());
        Assertions.assertEquals("Unreachable nodes detected: orphan1, orphan2", ex.getMessage());
    }

    @Test
    public void testReachabilityFixedByEdgeOrBranch() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity).addNode("b", identity).addNode("c", identity);
        config.setEntryPoint("a");

        Assertions.assertThrows(FlowGraphException.class, config::compile);

        config.addEdge("a", "b");
        FlowGraphException ex = Assertions.assertThrows(FlowGraphException.class, config::compile);
        Assertions.assertEquals(List.of("c"), ex.getNodeIds());

        // 分支目标同样计入可达性
        config.addConditionalEdges("b", (Object x) -> x != null, Map.of(true, "c"));
        Assertions.assertDoesNotThrow(config::compile);
    }

    @Test
    public void testEmptyGraphIsValid() {
        FlowGraphEngine<Object, Object> engine = new GraphConfig<>().compile();

        Assertions.assertDoesNotThrow(engine::validate);
        Assertions.assertTrue(engine.getPlan().getNodes().isEmpty());
    }

    @Test
    public void testTypeMismatchOnEdge() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("producer", identity, null, typed(null, ValueType.NUMBER));
        config.addNode("consumer", identity, null, typed(ValueType.STRING, null));
        config.setEntryPoint("producer");
        config.addEdge("producer", "consumer");
        config.setFinishPoint("consumer");

        FlowGraphException ex = Assertions.assertThrows(FlowGraphException.class, config::compile);

        Assertions.assertEquals(ErrorKind.TYPE_MISMATCH, ex.getKind());
        Assertions.assertEquals(List.of("producer", "consumer"), ex.getNodeIds());
        Assertions.assertEquals("Type mismatch: producer outputs NUMBER, but consumer expects STRING", ex.getMessage());
    }

    @Test
    public void testMatchingOrMissingTypesPass() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity, null, typed(null, ValueType.MAP));
        config.addNode("b", identity, null, typed(ValueType.MAP, ValueType.LIST));
        config.addNode("c", identity);
        config.setEntryPoint("a");
        config.addEdge("a", "b");
        config.addEdge("b", "c");
        config.setFinishPoint("c");

        Assertions.assertDoesNotThrow(config::compile);
    }

    @Test
    public void testBranchTransitionsAreNotTypeChecked() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity, null, typed(null, ValueType.NUMBER));
        config.addNode("b", identity, null, typed(ValueType.STRING, null));
        config.setEntryPoint("a");
        config.addBranch("a", "next", Branch.then("b"));
        config.setFinishPoint("b");

        Assertions.assertDoesNotThrow(config::compile);
    }

    @Test
    public void testSameBranchKeyReplacesBranch() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity).addNode("b", identity).addNode("c", identity);
        config.setEntryPoint("a");
        config.addEdge("a", "c");
        config.addBranch("a", "next", Branch.then("b"));
        config.addBranch("a", "next", Branch.then("c"));

        // b 只被已替换的分支引用
        FlowGraphException ex = Assertions.assertThrows(FlowGraphException.class, config::compile);
        Assertions.assertEquals(List.of("b"), ex.getNodeIds());
        Assertions.assertEquals(1, config.getBranchTable().get("a").size());
    }

    @Test
    public void testPlanIsSnapshotOfConfig() throws Exception {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity);
        config.setEntryPoint("a");
        config.setFinishPoint("a");
        FlowGraphEngine<Object, Object> engine = config.compile();

        config.addNode("b", identity);
        config.addEdge("a", "b");

        Assertions.assertEquals(1, engine.getPlan().getNodes().size());
        Assertions.assertEquals(List.of(GraphConstants.END), engine.getPlan().successors("a"));
        Assertions.assertDoesNotThrow(engine::validate);
        Assertions.assertEquals("x", engine.apply("x"));
    }

    @Test
    public void testMetadataIsCarried() {
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity, null, NodeOptions.builder().metadata(Map.of("owner", "search")).build());
        config.setEntryPoint("a");

        ExecutionPlan plan = config.compile().getPlan();

        Assertions.assertEquals("search", plan.getNodes().get("a").getOptions().getMetadata().get("owner"));
    }

    @Test
    public void testMetadataIsCopiedOnRegistration() {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("owner", "search");
        GraphConfig<Object, Object> config = new GraphConfig<>();
        config.addNode("a", identity, null, NodeOptions.builder().metadata(metadata).build());
        config.setEntryPoint("a");
        ExecutionPlan plan = config.compile().getPlan();

        metadata.put("owner", "ads");
        metadata.put("extra", 1);

        Map<String, Object> carried = plan.getNodes().get("a").getOptions().getMetadata();
        Assertions.assertEquals(Map.of("owner", "search"), carried);
        Assertions.assertThrows(UnsupportedOperationException.class, () -> carried.put("k", "v"));
    }
}
