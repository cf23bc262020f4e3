package typesafeschwalbe.desugar.exhaustive;

import java.util.List;

public enum Coverage {
    COVERED,
    NOT_COVERED,
    UNKNOWN;

    public static Coverage of(boolean covered) {
        return covered? COVERED : NOT_COVERED;
    }

    public Coverage and(Coverage other) {
        if(this == UNKNOWN || other == UNKNOWN) { return UNKNOWN; }
        return Coverage.of(this == COVERED && other == COVERED);
    }

    // UNKNOWN anywhere makes the whole verdict undecidable
    public static Coverage any(List<Coverage> verdicts) {
        boolean covered = false;
        for(Coverage verdict: verdicts) {
            if(verdict == UNKNOWN) { return UNKNOWN; }
            covered |= verdict == COVERED;
        }
        return Coverage.of(covered);
    }

}
