package typesafeschwalbe.desugar.operators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static typesafeschwalbe.desugar.Trees.app;
import static typesafeschwalbe.desugar.Trees.binary;
import static typesafeschwalbe.desugar.Trees.bchain;
import static typesafeschwalbe.desugar.Trees.bvar;
import static typesafeschwalbe.desugar.Trees.chain;
import static typesafeschwalbe.desugar.Trees.fixity;
import static typesafeschwalbe.desugar.Trees.module;
import static typesafeschwalbe.desugar.Trees.name;
import static typesafeschwalbe.desugar.Trees.parens;
import static typesafeschwalbe.desugar.Trees.value;
import static typesafeschwalbe.desugar.Trees.valueOf;
import static typesafeschwalbe.desugar.Trees.var;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.desugar.Error;
import typesafeschwalbe.desugar.ErrorException;
import typesafeschwalbe.desugar.Source;
import typesafeschwalbe.desugar.ast.AstNode;
import typesafeschwalbe.desugar.ast.Binder;
import typesafeschwalbe.desugar.ast.Fixity;
import typesafeschwalbe.desugar.ast.Module;

class RebracketerTest {

    private Rebracketer rebracketer;

    @BeforeEach
    void setUp() throws ErrorException {
        OperatorTable table = new FixityTableBuilder()
            .addModule(module(
                fixity(Fixity.Associativity.LEFT, 6, "+"),
                fixity(Fixity.Associativity.LEFT, 6, "-"),
                fixity(Fixity.Associativity.LEFT, 7, "*"),
                fixity(Fixity.Associativity.RIGHT, 8, "^"),
                fixity(Fixity.Associativity.RIGHT, 6, "++"),
                fixity(Fixity.Associativity.NONE, 4, "=="),
                fixity(Fixity.Associativity.RIGHT, 6, ":")
            ))
            .build();
        this.rebracketer = new Rebracketer(table);
    }

    private AstNode rebracketValue(AstNode expression) throws ErrorException {
        Module rebracketed = this.rebracketer.rebracket(
            module(value("v", expression))
        );
        return valueOf(rebracketed, "v");
    }

    @Test
    void higherPrecedence_bindsTighterOnTheRight() throws ErrorException {
        AstNode flat = chain(chain(var("a"), "+", var("b")), "*", var("c"));

        assertThat(this.rebracketValue(flat)).isEqualTo(
            binary("+", var("a"), binary("*", var("b"), var("c")))
        );
    }

    @Test
    void higherPrecedence_bindsTighterOnTheLeft() throws ErrorException {
        AstNode flat = chain(var("a"), "*", chain(var("b"), "+", var("c")));

        assertThat(this.rebracketValue(flat)).isEqualTo(
            binary("+", binary("*", var("a"), var("b")), var("c"))
        );
    }

    @Test
    void rightAssociativeChain_foldsRight() throws ErrorException {
        AstNode flat = chain(chain(var("a"), "^", var("b")), "^", var("c"));

        assertThat(this.rebracketValue(flat)).isEqualTo(
            binary("^", var("a"), binary("^", var("b"), var("c")))
        );
    }

    @Test
    void leftAssociativeChain_foldsLeft() throws ErrorException {
        AstNode flat = chain(var("a"), "-", chain(var("b"), "+", var("c")));

        assertThat(this.rebracketValue(flat)).isEqualTo(
            binary("+", binary("-", var("a"), var("b")), var("c"))
        );
    }

    @Test
    void longMixedChain_respectsAllPrecedences() throws ErrorException {
        // a + b * c ^ d ^ e - f
        AstNode flat = chain(var("a"), "+", chain(var("b"), "*",
            chain(var("c"), "^", chain(var("d"), "^",
                chain(var("e"), "-", var("f"))))));

        AstNode power = binary("^", var("c"), binary("^", var("d"), var("e")));
        assertThat(this.rebracketValue(flat)).isEqualTo(binary(
            "-", binary("+", var("a"), binary("*", var("b"), power)), var("f")
        ));
    }

    @Test
    void rebracketing_isIdempotent() throws ErrorException {
        AstNode flat = chain(chain(var("a"), "+", var("b")), "*", var("c"));
        Module once = this.rebracketer.rebracket(module(value("v", flat)));
        Module twice = this.rebracketer.rebracket(once);

        assertThat(twice.declarations()).isEqualTo(once.declarations());
    }

    @Test
    void explicitParentheses_areKeptAsGroupingAndRemoved() throws ErrorException {
        AstNode flat = chain(
            parens(chain(var("a"), "+", var("b"))), "*", var("c")
        );

        assertThat(this.rebracketValue(flat)).isEqualTo(
            binary("*", binary("+", var("a"), var("b")), var("c"))
        );
        assertThat(this.rebracketValue(parens(var("a")))).isEqualTo(var("a"));
    }

    @Test
    void chainsInsideOperands_areRebracketed() throws ErrorException {
        AstNode flat = app(
            var("f"), parens(chain(chain(var("a"), "+", var("b")), "*", var("c")))
        );

        assertThat(this.rebracketValue(flat)).isEqualTo(app(
            var("f"), binary("+", var("a"), binary("*", var("b"), var("c")))
        ));
    }

    @Test
    void unknownOperator_bindsLoosest() throws ErrorException {
        AstNode flat = chain(chain(var("a"), "<?>", var("b")), "*", var("c"));

        assertThat(this.rebracketValue(flat)).isEqualTo(
            binary("<?>", var("a"), binary("*", var("b"), var("c")))
        );
    }

    @Test
    void nonAssociativeChain_isFatal() {
        AstNode flat = chain(chain(var("a"), "==", var("b")), "==", var("c"));

        assertThatThrownBy(() -> this.rebracketValue(flat))
            .isInstanceOf(ErrorException.class)
            .satisfies(e -> assertThat(((ErrorException) e).error.kind())
                .isEqualTo(Error.Kind.NON_ASSOCIATIVE_CHAIN));
    }

    @Test
    void mixedAssociativity_isFatal() {
        AstNode flat = chain(chain(var("a"), "+", var("b")), "++", var("c"));

        assertThatThrownBy(() -> this.rebracketValue(flat))
            .isInstanceOf(ErrorException.class)
            .satisfies(e -> {
                Error error = ((ErrorException) e).error;
                assertThat(error.kind())
                    .isEqualTo(Error.Kind.MIXED_ASSOCIATIVITY);
                assertThat(error.message()).contains("infixl 6", "infixr 6");
            });
    }

    @Test
    void nonAssociativeOperator_betweenTighterOperators_isAccepted()
        throws ErrorException {
        AstNode flat = chain(
            chain(var("a"), "+", var("b")), "==", chain(var("c"), "*", var("d"))
        );

        assertThat(this.rebracketValue(flat)).isEqualTo(binary(
            "==",
            binary("+", var("a"), var("b")),
            binary("*", var("c"), var("d"))
        ));
    }

    @Test
    void binderChain_becomesOperatorApplications() throws ErrorException {
        Binder flat = bchain(bchain(bvar("x"), ":", bvar("y")), ":", bvar("zs"));

        Binder rebracketed = this.rebracketer.matchBinder(flat);

        assertThat(rebracketed.type)
            .isEqualTo(Binder.Type.OPERATOR_APPLICATION);
        Binder.OperatorApplication outer = rebracketed.getValue();
        assertThat(outer.operator()).isEqualTo(name(":"));
        assertThat(outer.left()).isEqualTo(bvar("x"));
        assertThat(outer.right()).isEqualTo(new Binder(
            Binder.Type.OPERATOR_APPLICATION,
            new Binder.OperatorApplication(name(":"), bvar("y"), bvar("zs")),
            null
        ));
    }

    @Test
    void binderChainWithoutOperator_isAnInternalError() {
        Binder malformed = new Binder(
            Binder.Type.BINARY_NO_PARENS,
            new Binder.BinaryNoParens(bvar("op"), bvar("x"), bvar("y")),
            new Source("Test/Main.purs", 0, 5)
        );

        assertThatThrownBy(() -> this.rebracketer.matchBinder(malformed))
            .isInstanceOf(IllegalStateException.class);
    }

}
