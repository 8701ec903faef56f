package max.shogi.engine.game.board.utils;

import max.shogi.engine.game.Game;
import max.shogi.engine.utils.notations.SfenUtils;

public class BoardGenerator {
    public static final String STANDARD_GAME = "lnsgkgsnl/1r5b1/ppppppppp/9/9/9/PPPPPPPPP/1B5R1/LNSGKGSNL b - 1";

    public static Game newStandardGame() {
        return SfenUtils.getGameFrom(STANDARD_GAME);
    }
}
