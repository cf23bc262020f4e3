package typesafeschwalbe.desugar.operators;

import static org.assertj.core.api.Assertions.assertThat;
import static typesafeschwalbe.desugar.Trees.app;
import static typesafeschwalbe.desugar.Trees.module;
import static typesafeschwalbe.desugar.Trees.negative;
import static typesafeschwalbe.desugar.Trees.num;
import static typesafeschwalbe.desugar.Trees.value;
import static typesafeschwalbe.desugar.Trees.valueOf;
import static typesafeschwalbe.desugar.Trees.var;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.desugar.Constants;
import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Module;

class SignedLiteralsTest {

    @Test
    void unaryMinus_becomesNegateApplication() {
        Module removed = SignedLiterals.remove(module(
            value("v", negative(num("1")))
        ));

        assertThat(valueOf(removed, "v"))
            .isEqualTo(app(var(Constants.NEGATE), num("1")));
    }

    @Test
    void nestedUnaryMinus_isRemovedEverywhere() {
        AstNode nested = app(var("f"), negative(negative(var("x"))));

        AstNode removed = SignedLiterals.removeNode(nested);

        assertThat(removed).isEqualTo(app(
            var("f"),
            app(var(Constants.NEGATE), app(var(Constants.NEGATE), var("x")))
        ));
    }

    @Test
    void negateApplication_keepsTheSource() {
        AstNode minus = negative(num("2"));

        AstNode removed = SignedLiterals.removeNode(minus);

        assertThat(removed.source).isEqualTo(minus.source);
    }

}
