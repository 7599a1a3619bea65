package com.reqflow.core.knowledge;

import com.reqflow.core.capability.KnowledgeGraphService;
import com.reqflow.core.model.GraphEdge;
import com.reqflow.core.model.GraphNode;
import com.reqflow.core.model.KnowledgeGraph;
import com.reqflow.core.model.RequirementItem;
import com.reqflow.core.model.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one small graph per scope in memory: a node per requirement, a node per significant
 * term, and a {@code MENTIONS} edge from each requirement to its terms. Search ranks the
 * scope's requirements by Jaccard similarity of their term sets to the query.
 */
@Service
public class InMemoryKnowledgeGraphService implements KnowledgeGraphService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKnowledgeGraphService.class);

    static final String REQUIREMENT = "requirement";
    static final String TERM = "term";
    static final String MENTIONS = "MENTIONS";

    private static final Set<String> STOP_WORDS = Set.of(
            "a", "an", "and", "any", "are", "as", "at", "be", "by", "for", "from", "in", "is", "it",
            "must", "of", "on", "or", "shall", "should", "that", "the", "this", "to", "will", "with");

    private final ConcurrentHashMap<String, Scope> scopes = new ConcurrentHashMap<>();

    @Override
    public KnowledgeGraph buildGraph(String scope, List<RequirementItem> items) {
        Scope graph = scopes.computeIfAbsent(scope, s -> new Scope());
        var nodes = new ArrayList<GraphNode>();
        var edges = new ArrayList<GraphEdge>();
        synchronized (graph) {
            for (RequirementItem item : items) {
                Set<String> terms = terms(item.text());
                graph.texts.put(item.id(), item.text());
                graph.terms.put(item.id(), terms);
                nodes.add(new GraphNode(item.id(), REQUIREMENT, item.text()));
                for (String term : terms) {
                    String termId = "term:" + term;
                    if (graph.termNodes.add(termId)) {
                        nodes.add(new GraphNode(termId, TERM, term));
                    }
                    edges.add(new GraphEdge(item.id(), termId, MENTIONS));
                }
            }
        }
        log.debug("Scope {}: indexed {} requirement(s), {} new node(s)", scope, items.size(), nodes.size());
        return new KnowledgeGraph(nodes, edges);
    }

    @Override
    public List<SearchHit> search(String scope, String query, int topK) {
        Scope graph = scopes.get(scope);
        if (graph == null) {
            return List.of();
        }
        Set<String> queryTerms = terms(query);
        var hits = new ArrayList<SearchHit>();
        synchronized (graph) {
            for (var entry : graph.terms.entrySet()) {
                double similarity = jaccard(queryTerms, entry.getValue());
                if (similarity > 0.0) {
                    hits.add(new SearchHit(entry.getKey(), graph.texts.get(entry.getKey()), similarity));
                }
            }
        }
        hits.sort(Comparator.comparingDouble(SearchHit::similarity).reversed());
        return hits.size() > topK ? List.copyOf(hits.subList(0, topK)) : hits;
    }

    @Override
    public void release(String scope) {
        if (scopes.remove(scope) != null) {
            log.debug("Released knowledge graph scope {}", scope);
        }
    }

    static Set<String> terms(String text) {
        var terms = new LinkedHashSet<String>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 1 && !STOP_WORDS.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int common = 0;
        for (String term : a) {
            if (b.contains(term)) {
                common++;
            }
        }
        return (double) common / (a.size() + b.size() - common);
    }

    private static final class Scope {
        final Map<String, String> texts = new LinkedHashMap<>();
        final Map<String, Set<String>> terms = new LinkedHashMap<>();
        final Set<String> termNodes = new LinkedHashSet<>();
    }
}
