package typesafeschwalbe.desugar.operators;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.desugar.Error;
import typesafeschwalbe.desugar.ErrorException;
import typesafeschwalbe.desugar.Source;
import typesafeschwalbe.desugar.ast.Fixity;

// operand0 op1 operand1 ... opN operandN, reduced by precedence climbing
class OperatorChain<T> {

    static record Link<T>(
        T operator,
        String name,
        Fixity fixity,
        Source source
    ) {}

    @FunctionalInterface
    interface Reapply<T> {
        T apply(Link<T> operator, T left, T right);
    }

    private static Error makeNonAssociativeError(
        Link<?> nonAssociative, Link<?> chained, Source location
    ) {
        return new Error(
            Error.Kind.NON_ASSOCIATIVE_CHAIN,
            "Operator " + nonAssociative.name() + " is non-associative"
                + " and cannot be chained with " + chained.name()
                + " at precedence " + nonAssociative.fixity().precedence(),
            location
        );
    }

    private static Error makeMixedAssociativityError(
        Link<?> first, Link<?> second
    ) {
        return new Error(
            Error.Kind.MIXED_ASSOCIATIVITY,
            "Operators " + first.name() + " (" + first.fixity() + ") and "
                + second.name() + " (" + second.fixity() + ")"
                + " share a precedence but not an associativity",
            second.source()
        );
    }

    private final List<T> operands;
    private final List<Link<T>> operators;

    OperatorChain() {
        this.operands = new ArrayList<>();
        this.operators = new ArrayList<>();
    }

    void operand(T operand) {
        this.operands.add(operand);
    }

    void operator(Link<T> operator) {
        this.operators.add(operator);
    }

    T reduce(Reapply<T> reapply) throws ErrorException {
        if(this.operands.size() != this.operators.size() + 1) {
            throw new IllegalStateException(
                "Operator chain does not alternate operands and operators!"
            );
        }
        List<T> operands = this.operands;
        List<Link<T>> operators = this.operators;
        while(!operators.isEmpty()) {
            int precedence = Integer.MIN_VALUE;
            for(Link<T> operator: operators) {
                precedence = Math.max(
                    precedence, operator.fixity().precedence()
                );
            }
            List<T> nextOperands = new ArrayList<>();
            List<Link<T>> nextOperators = new ArrayList<>();
            T current = operands.get(0);
            int opI = 0;
            while(opI < operators.size()) {
                Link<T> operator = operators.get(opI);
                if(operator.fixity().precedence() != precedence) {
                    nextOperands.add(current);
                    nextOperators.add(operator);
                    current = operands.get(opI + 1);
                    opI += 1;
                    continue;
                }
                int runEnd = opI;
                while(runEnd < operators.size()
                    && operators.get(runEnd).fixity().precedence()
                        == precedence) {
                    runEnd += 1;
                }
                List<T> runOperands = new ArrayList<>();
                runOperands.add(current);
                runOperands.addAll(operands.subList(opI + 1, runEnd + 1));
                current = OperatorChain.reduceRun(
                    operators.subList(opI, runEnd), runOperands, reapply
                );
                opI = runEnd;
            }
            nextOperands.add(current);
            operands = nextOperands;
            operators = nextOperators;
        }
        return operands.get(0);
    }

    // all operators of a run share the highest remaining precedence
    private static <T> T reduceRun(
        List<Link<T>> run, List<T> operands, Reapply<T> reapply
    ) throws ErrorException {
        Fixity.Associativity associativity = run.get(0).fixity()
            .associativity();
        for(int linkI = 1; linkI < run.size(); linkI += 1) {
            Link<T> previous = run.get(linkI - 1);
            Link<T> link = run.get(linkI);
            Fixity.Associativity a = previous.fixity().associativity();
            Fixity.Associativity b = link.fixity().associativity();
            if(a == Fixity.Associativity.NONE) {
                throw new ErrorException(
                    OperatorChain.makeNonAssociativeError(
                        previous, link, link.source()
                    )
                );
            }
            if(b == Fixity.Associativity.NONE) {
                throw new ErrorException(
                    OperatorChain.makeNonAssociativeError(
                        link, previous, link.source()
                    )
                );
            }
            if(b != associativity) {
                throw new ErrorException(
                    OperatorChain.makeMixedAssociativityError(previous, link)
                );
            }
        }
        if(associativity == Fixity.Associativity.RIGHT) {
            T result = operands.get(operands.size() - 1);
            for(int linkI = run.size() - 1; linkI >= 0; linkI -= 1) {
                result = reapply.apply(
                    run.get(linkI), operands.get(linkI), result
                );
            }
            return result;
        }
        T result = operands.get(0);
        for(int linkI = 0; linkI < run.size(); linkI += 1) {
            result = reapply.apply(
                run.get(linkI), result, operands.get(linkI + 1)
            );
        }
        return result;
    }

}
