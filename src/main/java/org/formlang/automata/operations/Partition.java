package org.formlang.automata.operations;

import org.formlang.automata.base.State;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 状态集合的划分，用于 Hopcroft 最小化。
 * <p>
 * 每个等价类有一个编号，成员保存在一个 {@link DoublyLinkedList} 中；
 * 另外维护 状态 -> 类编号 和 状态 -> 链表节点 两个映射，
 * 因此查询一个状态所属的类和把状态移到另一个类都是 O(1) 的。
 * 任何时候每个状态都恰好属于一个类；拆分总是新建一个类编号，把一部分状态移进去。
 */
public class Partition {

    private static final Logger logger = LoggerFactory.getLogger(Partition.class);

    private final List<DoublyLinkedList<State>> classes = new ArrayList<>();
    private final Map<State, Integer> classIndexOf = new HashMap<>();
    private final Map<State, DoublyLinkedList<State>.Node> nodeOf = new HashMap<>();

    /**
     * 新建一个等价类。
     * @param members 类中的状态，不能已经属于其他类。
     * @return 新类的编号。
     */
    public int addClass(Collection<State> members) {
        Objects.requireNonNull(members, "Class members cannot be null.");
        for (State state : members) {
            if (classIndexOf.containsKey(state)) {
                throw new IllegalArgumentException("State " + state + " already belongs to class " + classIndexOf.get(state));
            }
        }
        int index = classes.size();
        DoublyLinkedList<State> list = new DoublyLinkedList<>();
        classes.add(list);
        for (State state : members) {
            nodeOf.put(state, list.append(state));
            classIndexOf.put(state, index);
        }
        logger.debug("新建等价类 {}: {}", index, list);
        return index;
    }

    public int getNumberClasses() {
        return classes.size();
    }

    /**
     * @return state 所属类的编号。
     * @throws IllegalArgumentException state 不在划分中。
     */
    public int getClassIndex(State state) {
        Integer index = classIndexOf.get(state);
        if (index == null) {
            throw new IllegalArgumentException("State " + state + " is not in the partition.");
        }
        return index;
    }

    public int getClassSize(int classIndex) {
        return classes.get(classIndex).size();
    }

    /**
     * @return 类中成员的快照。
     */
    public List<State> getClassMembers(int classIndex) {
        List<State> members = new ArrayList<>();
        classes.get(classIndex).forEach(members::add);
        return members;
    }

    /**
     * 找出被 states 真正拆分的类：类中既有属于 states 的成员，也有不属于的成员。
     * @param states 一个状态集合（通常是某个分割器的原像），不在划分中的状态会被忽略。
     * @return 被拆分的类的编号。
     */
    public List<Integer> getValidSets(Collection<State> states) {
        Map<Integer, Integer> hits = new LinkedHashMap<>();
        for (State state : new LinkedHashSet<>(states)) {
            Integer index = classIndexOf.get(state);
            if (index != null) {
                hits.merge(index, 1, Integer::sum);
            }
        }
        List<Integer> valid = new ArrayList<>();
        hits.forEach((index, count) -> {
            if (count < classes.get(index).size()) {
                valid.add(index);
            }
        });
        return valid;
    }

    /**
     * 把 toMove 中的状态从 classIndex 类移到一个新建的类中。
     * @param classIndex 被拆分的类。
     * @param toMove     要移动的状态，必须都属于 classIndex 类。
     * @return 新类的编号。
     */
    public int split(int classIndex, Collection<State> toMove) {
        for (State state : toMove) {
            if (getClassIndex(state) != classIndex) {
                throw new IllegalArgumentException("State " + state + " does not belong to class " + classIndex);
            }
        }
        int newIndex = classes.size();
        DoublyLinkedList<State> newClass = new DoublyLinkedList<>();
        classes.add(newClass);
        for (State state : toMove) {
            nodeOf.get(state).delete();
            nodeOf.put(state, newClass.append(state));
            classIndexOf.put(state, newIndex);
        }
        logger.debug("拆分等价类 {} -> {} 和 {}", classIndex, classes.get(classIndex), newClass);
        return newIndex;
    }

    /**
     * @return 所有非空的等价类。
     */
    public List<Set<State>> getGroups() {
        List<Set<State>> groups = new ArrayList<>();
        for (DoublyLinkedList<State> list : classes) {
            if (!list.isEmpty()) {
                Set<State> group = new LinkedHashSet<>();
                list.forEach(group::add);
                groups.add(group);
            }
        }
        return groups;
    }

    @Override
    public String toString() {
        return "Partition" + getGroups();
    }
}
