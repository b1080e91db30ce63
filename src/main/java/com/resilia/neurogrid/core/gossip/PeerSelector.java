package com.resilia.neurogrid.core.gossip;

import java.util.ArrayList;
import java.util.List;

/**
 * 轮转选择邻居，连续若干轮后每个邻居都会被选中
 */
public class PeerSelector {

    private final List<String> neighbours;
    private int cursor;

    public PeerSelector(List<String> neighbours) {
        this.neighbours = List.copyOf(neighbours);
    }

    public synchronized List<String> next(int fanout) {
        int count = Math.min(Math.max(0, fanout), neighbours.size());
        List<String> selected = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            selected.add(neighbours.get(cursor));
            cursor = (cursor + 1) % neighbours.size();
        }
        return selected;
    }

    public List<String> getNeighbours() {
        return neighbours;
    }
}
