package org.formlang.automata.operations;

import org.apache.commons.lang3.tuple.Pair;
import org.formlang.automata.base.Symbol;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Hopcroft 算法中待处理的分割器 (类编号, 符号) 列表。
 * 用一个 类数 × 符号数 的布尔矩阵记录哪些对已经在列表中，
 * 所以 insert、contains、pop 都是 O(1)，同一个对不会同时出现两次。
 */
public class HopcroftProcessingList {

    private final boolean[][] pending;
    private final Map<Symbol, Integer> symbolIndex = new HashMap<>();
    private final Deque<Pair<Integer, Symbol>> queue = new ArrayDeque<>();

    /**
     * @param maxClasses 类编号的上界（不含），等价类的个数不会超过状态个数。
     * @param symbols    字母表。
     */
    public HopcroftProcessingList(int maxClasses, Collection<Symbol> symbols) {
        for (Symbol symbol : symbols) {
            symbolIndex.putIfAbsent(symbol, symbolIndex.size());
        }
        this.pending = new boolean[maxClasses][symbolIndex.size()];
    }

    /**
     * @return 如果这个对原本不在列表中则返回 true。
     */
    public boolean insert(int classIndex, Symbol symbol) {
        int column = columnOf(symbol);
        if (pending[classIndex][column]) {
            return false;
        }
        pending[classIndex][column] = true;
        queue.push(Pair.of(classIndex, symbol));
        return true;
    }

    public boolean contains(int classIndex, Symbol symbol) {
        return pending[classIndex][columnOf(symbol)];
    }

    public Pair<Integer, Symbol> pop() {
        if (queue.isEmpty()) {
            throw new NoSuchElementException("The processing list is empty.");
        }
        Pair<Integer, Symbol> top = queue.pop();
        pending[top.getLeft()][columnOf(top.getRight())] = false;
        return top;
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    private int columnOf(Symbol symbol) {
        Integer column = symbolIndex.get(symbol);
        if (column == null) {
            throw new IllegalArgumentException("Unknown symbol " + symbol);
        }
        return column;
    }
}
