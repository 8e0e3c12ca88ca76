package com.immowatch.backend.dedup.engine;

/**
 * Disjoint sets over {@code 0..size-1} backed by parent and rank arrays.
 * Union by rank with path halving; on equal ranks the smaller index becomes the root.
 */
public class UnionFind {

    private final int[] parent;
    private final int[] rank;
    private int components;

    public UnionFind(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0, got " + size);
        }
        this.parent = new int[size];
        this.rank = new int[size];
        this.components = size;
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    public int find(int x) {
        while (parent[x] != x) {
            parent[x] = parent[parent[x]];
            x = parent[x];
        }
        return x;
    }

    /**
     * Merges the sets of {@code a} and {@code b}.
     *
     * @return true when two distinct sets were merged
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (rank[rootA] < rank[rootB] || (rank[rootA] == rank[rootB] && rootB < rootA)) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        if (rank[rootA] == rank[rootB]) {
            rank[rootA]++;
        }
        components--;
        return true;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public int componentCount() {
        return components;
    }

    public int size() {
        return parent.length;
    }
}
