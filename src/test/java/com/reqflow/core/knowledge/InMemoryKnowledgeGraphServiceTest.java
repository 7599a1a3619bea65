package com.reqflow.core.knowledge;

import com.reqflow.core.model.GraphNode;
import com.reqflow.core.model.RequirementItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryKnowledgeGraphServiceTest {

    private final InMemoryKnowledgeGraphService service = new InMemoryKnowledgeGraphService();

    @Test
    @DisplayName("terms drop stop words, single characters and punctuation")
    void terms() {
        assertEquals(Set.of("system", "export", "reports", "pdf"),
                InMemoryKnowledgeGraphService.terms("The system shall export reports as PDF, a!"));
    }

    @Test
    void jaccard() {
        assertEquals(0.0, InMemoryKnowledgeGraphService.jaccard(Set.of(), Set.of()));
        assertEquals(1.0, InMemoryKnowledgeGraphService.jaccard(Set.of("a", "b"), Set.of("b", "a")));
        assertEquals(1.0 / 3, InMemoryKnowledgeGraphService.jaccard(Set.of("a", "b"), Set.of("b", "c")), 1e-9);
    }

    @Test
    @DisplayName("build creates requirement and term nodes linked by mentions edges, terms shared across items")
    void buildGraph() {
        var graph = service.buildGraph("RF-1", List.of(
                RequirementItem.of("R1", "Export reports", null),
                RequirementItem.of("R2", "Print reports", null)));

        assertEquals(List.of("R1", "term:export", "term:reports", "R2", "term:print"),
                graph.nodes().stream().map(GraphNode::id).toList());
        assertEquals(4, graph.edges().size());
        assertTrue(graph.edges().stream().allMatch(e -> e.relation().equals("MENTIONS")));
    }

    @Test
    @DisplayName("search ranks by similarity, honours topK and is scoped")
    void search() {
        service.buildGraph("RF-1", List.of(
                RequirementItem.of("R1", "Users export monthly reports", null),
                RequirementItem.of("R2", "Users export reports", null),
                RequirementItem.of("R3", "Login uses single sign-on", null)));

        var hits = service.search("RF-1", "users export reports", 5);
        assertEquals(List.of("R2", "R1"), hits.stream().map(h -> h.itemId()).toList());
        assertEquals(1.0, hits.get(0).similarity(), 1e-9);
        assertEquals(0.75, hits.get(1).similarity(), 1e-9);

        assertEquals(1, service.search("RF-1", "users export reports", 1).size());
        assertTrue(service.search("RF-2", "users export reports", 5).isEmpty());
    }

    @Test
    @DisplayName("builds for the same scope accumulate until released")
    void accumulateAndRelease() {
        service.buildGraph("RF-1", List.of(RequirementItem.of("R1", "Export reports", null)));
        service.buildGraph("RF-1", List.of(RequirementItem.of("R2", "Export invoices", null)));

        assertEquals(2, service.search("RF-1", "export", 5).size());

        service.release("RF-1");
        assertTrue(service.search("RF-1", "export", 5).isEmpty());
    }
}
