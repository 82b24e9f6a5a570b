package com.workhub.core.graph;

import com.workhub.core.nodes.ClassifyIntentNode;
import com.workhub.core.nodes.ComposeResponseNode;
import com.workhub.core.nodes.ExtractEntitiesNode;
import com.workhub.core.nodes.RouteActionNode;
import com.workhub.core.state.WorkerMessageState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} for one message run.
 * <pre>
 *   START -> extract_entities -> classify_intent -> route_action -> compose_response -> END
 * </pre>
 */
@Component
public class AgentGraph {

    private static final Logger log = LoggerFactory.getLogger(AgentGraph.class);

    private final CompiledGraph<WorkerMessageState> compiledGraph;

    public AgentGraph(ExtractEntitiesNode extractNode,
                      ClassifyIntentNode classifyNode,
                      RouteActionNode routeNode,
                      ComposeResponseNode composeNode) throws Exception {

        var graph = new StateGraph<>(WorkerMessageState.SCHEMA, WorkerMessageState::new)
                .addNode("extract_entities", node_async(extractNode::apply))
                .addNode("classify_intent", node_async(classifyNode::apply))
                .addNode("route_action", node_async(routeNode::apply))
                .addNode("compose_response", node_async(composeNode::apply))
                .addEdge(START, "extract_entities")
                .addEdge("extract_entities", "classify_intent")
                .addEdge("classify_intent", "route_action")
                .addEdge("route_action", "compose_response")
                .addEdge("compose_response", END);

        this.compiledGraph = graph.compile();
        log.info("Message pipeline graph compiled");
    }

    public CompiledGraph<WorkerMessageState> getCompiledGraph() {
        return compiledGraph;
    }
}
