package max.shogi.engine.search;

import max.shogi.engine.game.Game;
import max.shogi.engine.utils.notations.MoveIOUtils;
import max.shogi.engine.utils.notations.SfenUtils;

final class DebugChecks {
    private DebugChecks() {}

    static void assertPositionRestored(Game g, long keyBefore, String sfenBefore) {
        String sfenAfter = SfenUtils.getSfenFromGame(g);
        if (g.zobristKey() != keyBefore || !sfenAfter.equals(sfenBefore)) {
            throw new IllegalStateException("Search left the position modified: " + sfenBefore + " -> " + sfenAfter);
        }
    }

    static void assertSoundMate(Game g, SearchResult result) {
        if (result.isMate() && !PrincipalVariation.isSoundMate(g, result.moves())) {
            throw new IllegalStateException("Unsound mating line " + MoveIOUtils.writeLine(result.moves())
                    + " from " + SfenUtils.getSfenFromGame(g));
        }
    }
}
