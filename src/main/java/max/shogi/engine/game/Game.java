package max.shogi.engine.game;

import max.shogi.engine.game.board.Board;
import max.shogi.engine.movegen.MoveGenerator;
import max.shogi.engine.movegen.utils.CheckUtils;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;
import max.shogi.engine.utils.notations.MoveIOUtils;
import max.shogi.engine.utils.notations.SfenUtils;

import java.util.ArrayList;
import java.util.List;

public class Game {
    private static final int[] MAX_IN_HAND = {0, 18, 4, 4, 4, 2, 2, 4};

    private final Board board;

    public int currentPlayer = ColorUtils.BLACK;
    public int moveNumber = 1;

    public Game() {
        board = new Board();
    }

    public Game(Game other) {
        board = new Board(other.board);
        currentPlayer = other.currentPlayer;
        moveNumber = other.moveNumber;
    }

    public Board board() {
        return board;
    }

    public long zobristKey() {
        return board.hashKey() ^ ZobristHashKeys.sideToMove(currentPlayer);
    }

    public void setCurrentPlayer(int color) {
        currentPlayer = color;
    }

    public void playMove(int move) {
        board.playMove(move, currentPlayer);
        currentPlayer = ColorUtils.switchColor(currentPlayer);
        moveNumber++;
    }

    public void undoMove(int move) {
        moveNumber--;
        currentPlayer = ColorUtils.switchColor(currentPlayer);
        board.undoMove(move, currentPlayer);
    }

    // Space separated USI moves, e.g. "7g7f 3c3d"
    public List<Integer> playMoves(String moves) {
        List<Integer> played = new ArrayList<>();
        for (String usi : moves.trim().split("\\s+")) {
            int move = MoveIOUtils.parseUsi(this, usi);
            playMove(move);
            played.add(move);
        }
        return played;
    }

    public boolean inCheck() {
        return isInCheck(currentPlayer);
    }

    public boolean isInCheck(int color) {
        return CheckUtils.isKingInCheck(board, color);
    }

    public int getLegalMoves(int[] buffer) {
        return MoveGenerator.generateLegalMoves(this, buffer);
    }

    public int[] getLegalMoves() {
        return MoveGenerator.generateLegalMoves(this);
    }

    public int getCheckingMoves(int[] buffer) {
        return MoveGenerator.generateCheckingMoves(this, buffer);
    }

    public boolean hasAnyLegalMove() {
        return MoveGenerator.hasLegalMove(this);
    }

    public boolean isCheckmate() {
        return inCheck() && !hasAnyLegalMove();
    }

    /**
     * Rejects positions the search cannot make sense of.
     * A side to move giving check is accepted: mate problems are sometimes set up that way.
     */
    public void validate() {
        int[] kings = new int[2];
        int[] material = new int[PieceUtils.KING];
        boolean[][] pawnFiles = new boolean[2][SquareUtils.SIZE + 1];
        for (int sq = 0; sq < SquareUtils.SQUARES; sq++) {
            byte code = board.getPieceAt(sq);
            if (PieceUtils.isEmpty(code)) continue;
            int color = PieceUtils.toColor(code);
            byte type = PieceUtils.toPieceCode(code);
            if (type != PieceUtils.KING) {
                material[PieceUtils.unpromote(type)]++;
            }
            switch (type) {
                case PieceUtils.KING -> kings[color]++;
                case PieceUtils.PAWN, PieceUtils.LANCE -> {
                    if (SquareUtils.isLastRank(sq, color)) {
                        throw new InvalidPositionException("Immobile " + PieceUtils.toPieceType(type) + " on " + MoveIOUtils.writeSquare(sq));
                    }
                    if (type == PieceUtils.PAWN) {
                        int file = SquareUtils.file(sq);
                        if (pawnFiles[color][file]) {
                            throw new InvalidPositionException("Two " + ColorUtils.name(color) + " pawns on file " + file);
                        }
                        pawnFiles[color][file] = true;
                    }
                }
                case PieceUtils.KNIGHT -> {
                    if (SquareUtils.isLastTwoRanks(sq, color)) {
                        throw new InvalidPositionException("Immobile knight on " + MoveIOUtils.writeSquare(sq));
                    }
                }
                default -> {
                }
            }
        }
        for (int color = 0; color < 2; color++) {
            if (kings[color] != 1) {
                throw new InvalidPositionException("Expected exactly one " + ColorUtils.name(color) + " king, found " + kings[color]);
            }
            for (int type = PieceUtils.PAWN; type < PieceUtils.KING; type++) {
                int count = board.handCount(color, type);
                if (count < 0 || count > MAX_IN_HAND[type]) {
                    throw new InvalidPositionException("Invalid " + ColorUtils.name(color) + " hand count " + count + " for " + PieceUtils.toPieceType(type));
                }
                material[type] += count;
            }
        }
        // A set holds as many of each piece as a single hand may
        for (int type = PieceUtils.PAWN; type < PieceUtils.KING; type++) {
            if (material[type] > MAX_IN_HAND[type]) {
                throw new InvalidPositionException("Too many " + PieceUtils.toPieceType(type) + " in play: " + material[type]);
            }
        }
    }

    public static int maxInHand(int type) {
        return MAX_IN_HAND[type];
    }

    @Override
    public String toString() {
        return SfenUtils.getSfenFromGame(this);
    }
}
