package org.formlang.regex;

import org.formlang.automata.base.State;
import org.formlang.automata.base.Symbol;
import org.formlang.automata.models.EpsilonNFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Thompson 构造：把正则表达式翻译成 epsilon-NFA。
 * <p>
 * 递归时显式传递一个构造上下文（状态计数器和目标自动机），不会把任何状态写回语法树。
 * 起始状态为 0，终止状态为 1，其余状态按分配顺序编号。
 */
public final class ThompsonConstruction {

    private static final Logger logger = LoggerFactory.getLogger(ThompsonConstruction.class);

    /**
     * 一次构造过程的上下文，由 {@link #build(Regex)} 创建并独占。
     */
    private static final class BuildContext {
        private final EpsilonNFA enfa = new EpsilonNFA();
        private int counter = 0;

        private State newState() {
            return State.of(counter++);
        }

        private void epsilon(State from, State to) {
            enfa.addTransition(from, Symbol.EPSILON, to);
        }
    }

    private ThompsonConstruction() {
    }

    public static EpsilonNFA build(Regex regex) {
        Objects.requireNonNull(regex, "Regex cannot be null.");
        BuildContext context = new BuildContext();
        State start = context.newState();
        State end = context.newState();
        context.enfa.addStartState(start);
        context.enfa.addFinalState(end);
        process(regex, start, end, context);
        logger.debug("Thompson 构造 {}: {} 个状态, {} 条边", regex,
                context.enfa.getNumberStates(), context.enfa.getNumberTransitions());
        return context.enfa;
    }

    /**
     * 在 from 和 to 之间接入 regex 对应的子自动机。
     */
    private static void process(Regex regex, State from, State to, BuildContext context) {
        switch (regex.getOperator()) {
            case SYMBOL -> context.enfa.addTransition(from, regex.getSymbol(), to);
            case EPSILON -> context.epsilon(from, to);
            case EMPTY -> {
                // 空语言不产生任何边
            }
            case CONCATENATION -> {
                State middleLeft = context.newState();
                State middleRight = context.newState();
                process(regex.getSons().get(0), from, middleLeft, context);
                context.epsilon(middleLeft, middleRight);
                process(regex.getSons().get(1), middleRight, to, context);
            }
            case UNION -> {
                for (Regex son : regex.getSons()) {
                    State branchStart = context.newState();
                    State branchEnd = context.newState();
                    context.epsilon(from, branchStart);
                    process(son, branchStart, branchEnd, context);
                    context.epsilon(branchEnd, to);
                }
            }
            case KLEENE_STAR -> {
                State bodyStart = context.newState();
                State bodyEnd = context.newState();
                context.epsilon(from, to);
                context.epsilon(from, bodyStart);
                context.epsilon(bodyEnd, to);
                context.epsilon(bodyEnd, bodyStart);
                process(regex.getSons().get(0), bodyStart, bodyEnd, context);
            }
        }
    }
}
