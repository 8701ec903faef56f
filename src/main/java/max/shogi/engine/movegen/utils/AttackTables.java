package max.shogi.engine.movegen.utils;

import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;

/**
 * Precomputed geometry of the 9x9 board.
 * Directions are given from black's point of view (north = toward rank 1):
 * 0 N, 1 S, 2 W (file - 1), 3 E (file + 1), 4 NW, 5 NE, 6 SW, 7 SE.
 */
public final class AttackTables {
    public static final int DIRECTIONS = 8;
    public static final int[] FILE_DELTA = {0, 0, -1, 1, -1, 1, -1, 1};
    public static final int[] RANK_DELTA = {-1, 1, 0, 0, -1, -1, 1, 1};
    public static final int[] OPPOSITE = {1, 0, 3, 2, 7, 6, 5, 4};
    // Mirror of each direction seen from white's side
    private static final int[] MIRROR = {1, 0, 2, 3, 6, 7, 4, 5};

    // NEIGHBOR[square][direction], -1 when off board
    public static final int[][] NEIGHBOR = new int[SquareUtils.SQUARES][DIRECTIONS];
    // KNIGHT_JUMPS[color][square]
    public static final int[][][] KNIGHT_JUMPS = new int[2][SquareUtils.SQUARES][];

    // Direction bit masks indexed by board code (type | color << 4)
    public static final int[] STEP_MASK = new int[32];
    public static final int[] SLIDE_MASK = new int[32];

    private static final int N = 1, S = 1 << 1, W = 1 << 2, E = 1 << 3, NW = 1 << 4, NE = 1 << 5, SW = 1 << 6, SE = 1 << 7;
    private static final int ORTHOGONAL = N | S | W | E;
    private static final int DIAGONAL = NW | NE | SW | SE;
    private static final int GOLD_STEPS = N | S | W | E | NW | NE;

    static {
        for (int sq = 0; sq < SquareUtils.SQUARES; sq++) {
            int file = SquareUtils.file(sq);
            int rank = SquareUtils.rank(sq);
            for (int dir = 0; dir < DIRECTIONS; dir++) {
                int f = file + FILE_DELTA[dir];
                int r = rank + RANK_DELTA[dir];
                NEIGHBOR[sq][dir] = SquareUtils.isOnBoard(f, r) ? SquareUtils.square(f, r) : -1;
            }
            for (int color = 0; color < 2; color++) {
                int r = rank + 2 * SquareUtils.forward(color);
                int count = 0;
                int[] jumps = new int[2];
                for (int df = -1; df <= 1; df += 2) {
                    if (SquareUtils.isOnBoard(file + df, r)) {
                        jumps[count++] = SquareUtils.square(file + df, r);
                    }
                }
                KNIGHT_JUMPS[color][sq] = java.util.Arrays.copyOf(jumps, count);
            }
        }

        int[] blackSteps = new int[PieceUtils.DRAGON + 1];
        int[] blackSlides = new int[PieceUtils.DRAGON + 1];
        blackSteps[PieceUtils.PAWN] = N;
        blackSlides[PieceUtils.LANCE] = N;
        blackSteps[PieceUtils.SILVER] = N | NW | NE | SW | SE;
        blackSlides[PieceUtils.BISHOP] = DIAGONAL;
        blackSlides[PieceUtils.ROOK] = ORTHOGONAL;
        blackSteps[PieceUtils.GOLD] = GOLD_STEPS;
        blackSteps[PieceUtils.KING] = ORTHOGONAL | DIAGONAL;
        blackSteps[PieceUtils.PRO_PAWN] = GOLD_STEPS;
        blackSteps[PieceUtils.PRO_LANCE] = GOLD_STEPS;
        blackSteps[PieceUtils.PRO_KNIGHT] = GOLD_STEPS;
        blackSteps[PieceUtils.PRO_SILVER] = GOLD_STEPS;
        blackSlides[PieceUtils.HORSE] = DIAGONAL;
        blackSteps[PieceUtils.HORSE] = ORTHOGONAL;
        blackSlides[PieceUtils.DRAGON] = ORTHOGONAL;
        blackSteps[PieceUtils.DRAGON] = DIAGONAL;

        for (int type = PieceUtils.PAWN; type <= PieceUtils.DRAGON; type++) {
            STEP_MASK[PieceUtils.encode(type, ColorUtils.BLACK)] = blackSteps[type];
            SLIDE_MASK[PieceUtils.encode(type, ColorUtils.BLACK)] = blackSlides[type];
            STEP_MASK[PieceUtils.encode(type, ColorUtils.WHITE)] = mirror(blackSteps[type]);
            SLIDE_MASK[PieceUtils.encode(type, ColorUtils.WHITE)] = mirror(blackSlides[type]);
        }
    }

    private AttackTables() {}

    private static int mirror(int mask) {
        int mirrored = 0;
        for (int dir = 0; dir < DIRECTIONS; dir++) {
            if ((mask & (1 << dir)) != 0) {
                mirrored |= 1 << MIRROR[dir];
            }
        }
        return mirrored;
    }

    public static boolean steps(int pieceCode, int dir) {
        return (STEP_MASK[pieceCode] & (1 << dir)) != 0;
    }

    public static boolean slides(int pieceCode, int dir) {
        return (SLIDE_MASK[pieceCode] & (1 << dir)) != 0;
    }
}
