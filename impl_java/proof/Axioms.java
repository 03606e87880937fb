package proof;

import fol.formula.Formula;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Trusted statements of an ambient theory. Their free variables are schematic, see
 * {@link Rules#instantiate(Theorem, fol.Substitution)}.
 */
public final class Axioms {
    private static final Logger LOGGER = LoggerFactory.getLogger(Axioms.class);

    private Axioms() {
    }

    public static Theorem axiom(String name, Sequent statement) {
        LOGGER.debug("Axiom {}: {}", name, statement);
        return new Theorem(statement, "Axiom " + name, List.of());
    }

    public static Theorem axiom(String name, Formula statement) {
        return axiom(name, Sequent.proving(statement));
    }
}
