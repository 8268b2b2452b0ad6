package com.example.report.docgen.field;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered, immutable node sequence forming one field. The nodes must end up
 * contiguous and in this order inside a single run.
 */
@ToString
@EqualsAndHashCode
public final class FieldNodes implements Iterable<FieldNode> {

    private final List<FieldNode> nodes;

    public FieldNodes(FieldNode... nodes) {
        this.nodes = Collections.unmodifiableList(Arrays.asList(nodes.clone()));
    }

    public List<FieldNode> asList() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public FieldNode get(int index) {
        return nodes.get(index);
    }

    @Override
    public Iterator<FieldNode> iterator() {
        return nodes.iterator();
    }
}
