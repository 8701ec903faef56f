package max.shogi.engine.movegen;

import max.shogi.engine.game.Game;
import max.shogi.engine.game.board.Board;
import max.shogi.engine.movegen.utils.AttackTables;
import max.shogi.engine.search.SearchConstants;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;

import java.util.ArrayDeque;
import java.util.Arrays;

/**
 * Pseudo-legal generation followed by a make/test/unmake legality filter.
 * Board moves come first, in square order, then drops in {@link PieceUtils#HAND_TYPES} order,
 * so the output is stable for a given position.
 */
public final class MoveGenerator {
    public static long GENERATED_MOVES = 0;
    public static long FILTERED_MOVES = 0;

    private static final ThreadLocal<ArrayDeque<int[]>> SPARE_BUFFERS = ThreadLocal.withInitial(ArrayDeque::new);

    private MoveGenerator() {}

    public static int[] generateLegalMoves(Game game) {
        int[] buffer = new int[SearchConstants.MAX_MOVES];
        int n = generateLegalMoves(game, buffer);
        return Arrays.copyOf(buffer, n);
    }

    public static int generateLegalMoves(Game game, int[] buffer) {
        int n = generatePseudoLegalMoves(game, buffer);
        return filterLegal(game, buffer, n, false);
    }

    // Legal moves that leave the opponent in check
    public static int generateCheckingMoves(Game game, int[] buffer) {
        int n = generatePseudoLegalMoves(game, buffer);
        return filterLegal(game, buffer, n, true);
    }

    // Legal moves of the piece standing on square, drops excluded
    public static int generateMovesFrom(Game game, int square, int[] buffer) {
        Board board = game.board();
        if (!board.isOccupiedBy(square, game.currentPlayer)) {
            return 0;
        }
        int n = generateFrom(board, square, game.currentPlayer, buffer, 0);
        return filterLegal(game, buffer, n, false);
    }

    public static boolean hasLegalMove(Game game) {
        return hasLegalMove(game, new int[SearchConstants.MAX_MOVES]);
    }

    public static boolean hasLegalMove(Game game, int[] buffer) {
        int n = generatePseudoLegalMoves(game, buffer);
        for (int i = 0; i < n; i++) {
            if (isLegal(game, buffer[i])) return true;
        }
        return false;
    }

    public static int generatePseudoLegalMoves(Game game, int[] buffer) {
        final Board board = game.board();
        final int color = game.currentPlayer;
        int n = 0;
        for (int sq = 0; sq < SquareUtils.SQUARES; sq++) {
            if (board.isOccupiedBy(sq, color)) {
                n = generateFrom(board, sq, color, buffer, n);
            }
        }
        n = generateDrops(board, color, buffer, n);
        GENERATED_MOVES += n;
        return n;
    }

    private static int filterLegal(Game game, int[] buffer, int n, boolean checksOnly) {
        final int mover = game.currentPlayer;
        final int opponent = ColorUtils.switchColor(mover);
        int kept = 0;
        for (int i = 0; i < n; i++) {
            final int move = buffer[i];
            game.playMove(move);
            boolean legal = !game.isInCheck(mover);
            boolean check = legal && game.isInCheck(opponent);
            if (legal && check && isPawnDrop(move)) {
                // uchifuzume: a pawn drop may check but not mate
                legal = hasReplyToPawnDrop(game);
            }
            game.undoMove(move);
            if (legal && (!checksOnly || check)) {
                buffer[kept++] = move;
            }
        }
        FILTERED_MOVES += n - kept;
        return kept;
    }

    private static boolean isLegal(Game game, int move) {
        final int mover = game.currentPlayer;
        game.playMove(move);
        boolean legal = !game.isInCheck(mover);
        if (legal && isPawnDrop(move) && game.inCheck()) {
            legal = hasReplyToPawnDrop(game);
        }
        game.undoMove(move);
        return legal;
    }

    // Reply buffers are pooled per thread, one is taken for each nested pawn drop being tested
    private static boolean hasReplyToPawnDrop(Game game) {
        ArrayDeque<int[]> spares = SPARE_BUFFERS.get();
        int[] replies = spares.poll();
        if (replies == null) {
            replies = new int[SearchConstants.MAX_MOVES];
        }
        try {
            return hasLegalMove(game, replies);
        } finally {
            spares.push(replies);
        }
    }

    private static boolean isPawnDrop(int move) {
        return Move.isDrop(move) && Move.getPieceType(move) == PieceUtils.PAWN;
    }

    private static int generateFrom(Board board, int from, int color, int[] buffer, int n) {
        final byte code = board.getPieceAt(from);
        final byte type = PieceUtils.toPieceCode(code);

        if (type == PieceUtils.KNIGHT) {
            for (int to : AttackTables.KNIGHT_JUMPS[color][from]) {
                n = addTarget(board, from, to, type, color, buffer, n);
            }
            return n;
        }

        final int steps = AttackTables.STEP_MASK[code];
        final int slides = AttackTables.SLIDE_MASK[code];
        for (int dir = 0; dir < AttackTables.DIRECTIONS; dir++) {
            final int bit = 1 << dir;
            if ((slides & bit) != 0) {
                int to = AttackTables.NEIGHBOR[from][dir];
                while (to != -1) {
                    n = addTarget(board, from, to, type, color, buffer, n);
                    if (!board.isEmpty(to)) break;
                    to = AttackTables.NEIGHBOR[to][dir];
                }
            } else if ((steps & bit) != 0) {
                int to = AttackTables.NEIGHBOR[from][dir];
                if (to != -1) {
                    n = addTarget(board, from, to, type, color, buffer, n);
                }
            }
        }
        return n;
    }

    private static int addTarget(Board board, int from, int to, byte type, int color, int[] buffer, int n) {
        final byte target = board.getPieceAt(to);
        if (target != 0) {
            if (PieceUtils.toColor(target) == color) return n;
            // kings are mated, never taken
            if (PieceUtils.toPieceCode(target) == PieceUtils.KING) return n;
        }
        final byte captured = PieceUtils.toPieceCode(target);

        if (PieceUtils.canPromote(type)
                && (SquareUtils.isInPromotionZone(from, color) || SquareUtils.isInPromotionZone(to, color))) {
            buffer[n++] = Move.asBytes(from, to, type, captured, true);
            if (mustPromote(type, to, color)) {
                return n;
            }
        }
        buffer[n++] = Move.asBytes(from, to, type, captured, false);
        return n;
    }

    public static boolean mustPromote(int type, int to, int color) {
        return switch (type) {
            case PieceUtils.PAWN, PieceUtils.LANCE -> SquareUtils.isLastRank(to, color);
            case PieceUtils.KNIGHT -> SquareUtils.isLastTwoRanks(to, color);
            default -> false;
        };
    }

    private static int generateDrops(Board board, int color, int[] buffer, int n) {
        if (!board.hasPiecesInHand(color)) {
            return n;
        }
        boolean[] pawnFiles = null;
        for (byte type : PieceUtils.HAND_TYPES) {
            if (board.handCount(color, type) == 0) continue;
            if (type == PieceUtils.PAWN) {
                pawnFiles = new boolean[SquareUtils.SIZE + 1];
                for (int file = 1; file <= SquareUtils.SIZE; file++) {
                    pawnFiles[file] = board.hasPawnOnFile(color, file);
                }
            }
            for (int to = 0; to < SquareUtils.SQUARES; to++) {
                if (!board.isEmpty(to)) continue;
                // a dropped piece needs somewhere to go
                if (mustPromote(type, to, color)) continue;
                if (type == PieceUtils.PAWN && pawnFiles[SquareUtils.file(to)]) continue;
                buffer[n++] = Move.asDrop(to, type);
            }
        }
        return n;
    }

    public static void printGeneratorReport() {
        System.out.println("*************************");
        System.out.println("GENERATOR REPORT");
        System.out.println("GENERATED MOVES: " + GENERATED_MOVES);
        System.out.println("FILTERED MOVES: " + FILTERED_MOVES);
        System.out.println("*************************");
    }
}
