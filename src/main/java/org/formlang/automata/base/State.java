package org.formlang.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;

/**
 * 代表有限自动机中的一个状态。
 * State 是不可变对象，一旦创建，其值就不会改变；相等性只由值决定。
 */
public final class State implements Comparable<State> {

    private static final Logger logger = LoggerFactory.getLogger(State.class);

    /** 合并状态时各成员名称之间的分隔符 */
    public static final String MERGE_SEPARATOR = ";";

    @Getter
    private final Object value;

    private final int hashCode;

    private State(Object value) {
        this.value = Objects.requireNonNull(value, "State value cannot be null.");
        this.hashCode = value.hashCode();
        logger.debug("创建 State: {}", value);
    }

    /**
     * 工厂方法：把任意值包装成状态。
     * 如果传入的已经是 State，则原样返回。
     * @param value 状态的值。
     * @return 对应的 State 实例。
     */
    public static State of(Object value) {
        if (value instanceof State) {
            return (State) value;
        }
        return new State(value);
    }

    /**
     * 把一组状态合并成一个新状态。
     * 新状态的值是成员名称排序、去重之后用 ";" 连接得到的字符串，
     * 因此内容相同的两组状态总是得到相等的合并状态。
     * 成员名称中的 "\" 和 ";" 会先被转义，名称不同的两组状态不会得到相同的合并状态，
     * 例如 {"0;1"} 合并为 "0\;1"，而 {"0", "1"} 合并为 "0;1"。
     *
     * @param states 要合并的状态集合。
     * @return 合并后的状态。
     */
    public static State merge(Collection<State> states) {
        Objects.requireNonNull(states, "States to merge cannot be null.");
        TreeSet<String> names = new TreeSet<>();
        for (State state : states) {
            names.add(escape(state.toString()));
        }
        return new State(String.join(MERGE_SEPARATOR, names));
    }

    private static String escape(String name) {
        return name.replace("\\", "\\\\").replace(MERGE_SEPARATOR, "\\" + MERGE_SEPARATOR);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        State state = (State) o;
        return value.equals(state.value);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }

    @Override
    public int compareTo(State other) {
        return this.toString().compareTo(other.toString());
    }
}
