package typesafeschwalbe.desugar.exhaustive;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static typesafeschwalbe.desugar.Trees.bbool;
import static typesafeschwalbe.desugar.Trees.bnum;
import static typesafeschwalbe.desugar.Trees.bobject;
import static typesafeschwalbe.desugar.Trees.bvar;
import static typesafeschwalbe.desugar.Trees.ctor;
import static typesafeschwalbe.desugar.Trees.data;
import static typesafeschwalbe.desugar.Trees.dataConstructor;
import static typesafeschwalbe.desugar.Trees.module;
import static typesafeschwalbe.desugar.Trees.name;
import static typesafeschwalbe.desugar.Trees.wild;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import typesafeschwalbe.desugar.Trees;
import typesafeschwalbe.desugar.ast.Binder;

class MissingCasesTest {

    private MissingCases cases;

    @BeforeEach
    void setUp() {
        Environment env = Environment.builder()
            .addDataDeclarations(module(
                data("TF", dataConstructor("T", 0), dataConstructor("F", 0)),
                data(
                    "Maybe",
                    dataConstructor("Nothing", 0), dataConstructor("Just", 1)
                )
            ))
            .build();
        this.cases = new MissingCases(env, Trees.TEST);
    }

    private static Binder constant(String name) {
        return Binder.constructor(name(name), List.of());
    }

    @Test
    void wildcardClause_coversEverything() {
        MissingCases.Single result = this.cases.single(constant("T"), wild());

        assertThat(result.missing()).isEmpty();
        assertThat(result.coverage()).isEqualTo(Coverage.COVERED);
        assertThat(this.cases.single(wild(), bvar("x")).missing()).isEmpty();
    }

    @Test
    void wildcardAgainstConstructor_leavesSiblings() {
        MissingCases.Single result = this.cases.single(wild(), ctor("T"));

        assertThat(result.missing()).containsExactly(constant("F"));
        assertThat(result.coverage()).isEqualTo(Coverage.COVERED);
    }

    @Test
    void wildcardAgainstNestedConstructor_expandsArguments() {
        MissingCases.Single result = this.cases.single(
            wild(), ctor("Just", ctor("T"))
        );

        assertThat(result.missing()).containsExactly(
            constant("Nothing"),
            Binder.constructor(name("Just"), List.of(constant("F")))
        );
        assertThat(result.coverage()).isEqualTo(Coverage.COVERED);
    }

    @Test
    void differentConstructor_isNotCovered() {
        MissingCases.Single result = this.cases.single(
            constant("F"), ctor("T")
        );

        assertThat(result.missing()).containsExactly(constant("F"));
        assertThat(result.coverage()).isEqualTo(Coverage.NOT_COVERED);
    }

    @Test
    void sameConstructor_recursesIntoArguments() {
        Binder uncovered = Binder.constructor(
            name("Just"), List.of(Binder.wildcard())
        );

        MissingCases.Single result = this.cases.single(
            uncovered, ctor("Just", ctor("F"))
        );

        assertThat(result.missing()).containsExactly(
            Binder.constructor(name("Just"), List.of(constant("T")))
        );
        assertThat(result.coverage()).isEqualTo(Coverage.COVERED);
    }

    @Test
    void booleans_leaveTheOtherValue() {
        assertThat(this.cases.single(wild(), bbool(true)).missing())
            .containsExactly(Binder.bool(false));

        MissingCases.Single unequal = this.cases.single(
            Binder.bool(false), bbool(true)
        );
        assertThat(unequal.missing()).containsExactly(Binder.bool(false));
        assertThat(unequal.coverage()).isEqualTo(Coverage.NOT_COVERED);

        MissingCases.Single equal = this.cases.single(
            Binder.bool(true), bbool(true)
        );
        assertThat(equal.missing()).isEmpty();
        assertThat(equal.coverage()).isEqualTo(Coverage.COVERED);
    }

    @Test
    void opaqueLiteral_keepsTheColumnWithUnknownVerdict() {
        MissingCases.Single result = this.cases.single(wild(), bnum("0"));

        assertThat(result.missing()).containsExactly(Binder.wildcard());
        assertThat(result.coverage()).isEqualTo(Coverage.UNKNOWN);
    }

    @Test
    void objects_joinFieldsByName() {
        MissingCases.Single fromWildcard = this.cases.single(
            wild(), bobject(Map.of("b", bbool(true)))
        );
        assertThat(fromWildcard.missing()).containsExactly(
            Binder.object(Map.of("b", Binder.bool(false)))
        );

        Binder uncovered = Binder.object(Map.of("a", constant("T")));
        MissingCases.Single joined = this.cases.single(
            uncovered, bobject(Map.of("b", bbool(true)))
        );
        assertThat(joined.missing()).containsExactly(Binder.object(Map.of(
            "a", constant("T"), "b", Binder.bool(false)
        )));
        assertThat(joined.coverage()).isEqualTo(Coverage.COVERED);
    }

    @Test
    void namedAndTypedClauses_areTransparent() {
        Binder named = new Binder(
            Binder.Type.NAMED, new Binder.Named("t", ctor("T")), null
        );

        assertThat(this.cases.single(wild(), named).missing())
            .containsExactly(constant("F"));
    }

    @Test
    void multiple_replacesOneColumnAtATime() {
        MissingCases.Multiple result = this.cases.multiple(
            Binder.wildcards(2), List.of(ctor("T"), ctor("F"))
        );

        assertThat(result.missing()).containsExactly(
            List.of(constant("F"), Binder.wildcard()),
            List.of(Binder.wildcard(), constant("T"))
        );
        assertThat(result.coverage()).isEqualTo(Coverage.COVERED);
    }

    @Test
    void arityMismatch_isAnInternalError() {
        assertThatThrownBy(() -> this.cases.multiple(
            Binder.wildcards(2), List.of(wild())
        )).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void constructorMissingFromEnvironment_isAnInternalError() {
        assertThatThrownBy(() -> this.cases.single(wild(), ctor("Unknown")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Unknown");
    }

}
