package org.autosemi.asi;

import org.autosemi.lexer.LexerToken;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the token list, splicing a synthetic terminator in after the last significant
 * token of every line whose boundary was resolved to INSERT.
 * <p>
 * Original tokens are kept unchanged and in order; trailing whitespace and comments stay
 * after the inserted terminator.
 */
public class EmissionStage {

    public static List<LexerToken> emit(List<LexerToken> tokens, List<BoundaryDecision> decisions) {
        int[] insertAfter = new int[decisions.size()];
        int count = 0;
        for (BoundaryDecision decision : decisions) {
            if (decision.isInsert()) {
                insertAfter[count++] = decision.boundary.lastTokenIndex;
            }
        }

        List<LexerToken> result = new ArrayList<>(tokens.size() + count);
        int next = 0;
        for (int i = 0; i < tokens.size(); i++) {
            LexerToken token = tokens.get(i);
            result.add(token);
            if (next < count && insertAfter[next] == i) {
                result.add(LexerToken.syntheticTerminator(token));
                next++;
            }
        }
        return result;
    }
}
