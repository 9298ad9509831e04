package work.lumen.kernel.instruction;

import java.util.List;
import java.util.Objects;
import work.lumen.kernel.lex.Span;
import work.lumen.kernel.runtime.Value;

/**
 * Canonical instruction set every schema language reduces to. There are exactly seven kinds;
 * repetition is a flag on {@link Scope}, constants and variable reads are reserved {@link Operate}
 * operators.
 */
public interface Instruction {
    Tag tag();

    Span span();

    enum Tag {
        SEQUENCE,
        SCOPE,
        BRANCH,
        ASSIGN,
        INVOKE,
        OPERATE,
        TRANSFER
    }

    record Sequence(List<Instruction> body, Span span) implements Instruction {
        public Sequence {
            body = List.copyOf(body);
            Objects.requireNonNull(span, "span");
        }

        @Override
        public Tag tag() {
            return Tag.SEQUENCE;
        }
    }

    /** Runs {@code body} in a fresh frame; a repeating scope re-runs it (one frame per pass) until a break. */
    record Scope(Instruction body, boolean repeating, Span span) implements Instruction {
        public Scope {
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public Tag tag() {
            return Tag.SCOPE;
        }
    }

    /** {@code otherwise} may be {@code null}. */
    record Branch(Instruction condition, Instruction then, Instruction otherwise, Span span) implements Instruction {
        public Branch {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(then, "then");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public Tag tag() {
            return Tag.BRANCH;
        }
    }

    record Assign(String name, Instruction value, Mode mode, Span span) implements Instruction {
        public Assign {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(mode, "mode");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public Tag tag() {
            return Tag.ASSIGN;
        }

        public enum Mode {
            /** Update the nearest binding or create one in the current frame. */
            SET,
            /** Always create in the current frame. */
            BIND
        }
    }

    /**
     * Calls a function of the program ({@code extern == false}, {@code selector} is its name) or an
     * extern capability ({@code extern == true}). The two never fall back to each other.
     */
    record Invoke(String selector, List<Instruction> args, boolean extern, Span span) implements Instruction {
        public Invoke {
            Objects.requireNonNull(selector, "selector");
            args = List.copyOf(args);
            Objects.requireNonNull(span, "span");
        }

        public static Invoke function(String name, List<Instruction> args, Span span) {
            return new Invoke(name, args, false, span);
        }

        public static Invoke capability(String selector, List<Instruction> args, Span span) {
            return new Invoke(selector, args, true, span);
        }

        @Override
        public Tag tag() {
            return Tag.INVOKE;
        }
    }

    /**
     * Operator application. {@link #CONST} carries the literal source text in {@code immediate} and
     * its value in {@code constant}; {@link #LOAD} carries the variable name in {@code immediate}.
     * {@link #ITER} turns its single operand into a cursor, which is truthy while elements remain;
     * {@link #NEXT} takes the next element from the cursor named by {@code immediate}.
     */
    record Operate(String operator, List<Instruction> operands, String immediate, Value constant, Span span)
        implements Instruction {
        public static final String CONST = "const";
        public static final String LOAD = "load";
        public static final String ITER = "iter";
        public static final String NEXT = "next";

        public Operate {
            Objects.requireNonNull(operator, "operator");
            operands = List.copyOf(operands);
            Objects.requireNonNull(span, "span");
        }

        public static Operate constant(String text, Value value, Span span) {
            return new Operate(CONST, List.of(), text, Objects.requireNonNull(value, "value"), span);
        }

        public static Operate load(String name, Span span) {
            return new Operate(LOAD, List.of(), name, null, span);
        }

        public static Operate iterate(Instruction iterable, Span span) {
            return new Operate(ITER, List.of(iterable), null, null, span);
        }

        public static Operate advance(String cursor, Span span) {
            return new Operate(NEXT, List.of(), cursor, null, span);
        }

        public static Operate apply(String operator, List<Instruction> operands, Span span) {
            return new Operate(operator, operands, null, null, span);
        }

        @Override
        public Tag tag() {
            return Tag.OPERATE;
        }
    }

    /** {@code value} is only used by {@link Kind#RETURN} and may be {@code null}. */
    record Transfer(Kind kind, Instruction value, Span span) implements Instruction {
        public Transfer {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(span, "span");
        }

        @Override
        public Tag tag() {
            return Tag.TRANSFER;
        }

        public enum Kind {
            BREAK,
            CONTINUE,
            RETURN
        }
    }
}
