package org.worksindex.service.relations;

import lombok.extern.slf4j.Slf4j;
import org.worksindex.models.dto.RelatedDoi;
import org.worksindex.models.dto.RelationEdge;
import org.worksindex.models.dto.RelationIndexEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

@Slf4j
public final class RelationIndexBuilder {

    private RelationIndexBuilder() {
    }

    public static List<RelationEdge> symmetrize(Collection<RelationEdge> edges) {
        List<RelationEdge> both = new ArrayList<>(edges.size() * 2);
        for (RelationEdge edge : edges) {
            both.add(edge);
            both.add(edge.reversed());
        }
        return both;
    }

    public static List<RelationIndexEntry> build(Collection<RelationEdge> edges) {
        Map<String, Neighbours> adjacency = new TreeMap<>();
        int selfLoops = 0;
        for (RelationEdge edge : symmetrize(edges)) {
            if (edge.workDoi() == null || edge.relatedDoi() == null || !edge.hasCategory()) {
                continue;
            }
            if (edge.workDoi().equals(edge.relatedDoi())) {
                selfLoops++;
                continue;
            }
            Neighbours neighbours = adjacency.computeIfAbsent(edge.workDoi(), key -> new Neighbours());
            if (edge.intraWork()) {
                neighbours.intraWork.add(edge.relatedDoi());
            }
            if (edge.possibleSharedProject()) {
                neighbours.possibleSharedProject.add(edge.relatedDoi());
            }
            if (edge.datasetRelation()) {
                neighbours.datasetCitation.add(edge.relatedDoi());
            }
        }
        if (selfLoops > 0) {
            log.debug("[relations] Ignored {} self-referencing edges", selfLoops);
        }

        List<RelationIndexEntry> entries = new ArrayList<>(adjacency.size());
        for (Map.Entry<String, Neighbours> entry : adjacency.entrySet()) {
            Neighbours neighbours = entry.getValue();
            entries.add(new RelationIndexEntry(
                    entry.getKey(),
                    related(neighbours.intraWork),
                    related(neighbours.possibleSharedProject),
                    related(neighbours.datasetCitation)
            ));
        }
        log.info("[relations] Built relation index with {} entries from {} edges", entries.size(), edges.size());
        return entries;
    }

    private static List<RelatedDoi> related(SortedSet<String> dois) {
        return dois.stream().map(RelatedDoi::new).toList();
    }

    private static final class Neighbours {
        private final SortedSet<String> intraWork = new TreeSet<>();
        private final SortedSet<String> possibleSharedProject = new TreeSet<>();
        private final SortedSet<String> datasetCitation = new TreeSet<>();
    }
}
