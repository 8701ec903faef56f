package max.shogi.engine.game.board;

import max.shogi.engine.game.ZobristHashKeys;
import max.shogi.engine.movegen.Move;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;

import java.util.Arrays;

public class Board {
    private final byte[] pieceAt;
    // hands[color][type], only unpromoted PAWN..GOLD are used
    private final int[][] hands;
    private final int[] kingSquare;

    // Pieces and hands, side to move is hashed by Game
    private long hashKey;

    public Board() {
        this.pieceAt = new byte[SquareUtils.SQUARES];
        this.hands = new int[2][PieceUtils.KING];
        this.kingSquare = new int[]{-1, -1};
    }

    public Board(Board other) {
        this.pieceAt = other.pieceAt.clone();
        this.hands = new int[][]{other.hands[0].clone(), other.hands[1].clone()};
        this.kingSquare = other.kingSquare.clone();
        this.hashKey = other.hashKey;
    }

    public byte getPieceAt(int square) {
        return pieceAt[square];
    }

    public boolean isEmpty(int square) {
        return pieceAt[square] == 0;
    }

    public boolean isOccupiedBy(int square, int color) {
        byte code = pieceAt[square];
        return code != 0 && PieceUtils.toColor(code) == color;
    }

    public int handCount(int color, int type) {
        return hands[color][type];
    }

    public boolean hasPiecesInHand(int color) {
        int[] hand = hands[color];
        for (int type = PieceUtils.PAWN; type < PieceUtils.KING; type++) {
            if (hand[type] != 0) return true;
        }
        return false;
    }

    public int getKingSquare(int color) {
        return kingSquare[color];
    }

    public long hashKey() {
        return hashKey;
    }

    // Unpromoted pawn of this color somewhere on the file
    public boolean hasPawnOnFile(int color, int file) {
        byte pawn = PieceUtils.encode(PieceUtils.PAWN, color);
        for (int rank = 1; rank <= SquareUtils.SIZE; rank++) {
            if (pieceAt[SquareUtils.square(file, rank)] == pawn) return true;
        }
        return false;
    }

    // Setup only, keeps the key and king squares consistent
    public void setPiece(int square, int pieceType, int color) {
        clearSquare(square);
        byte code = PieceUtils.encode(pieceType, color);
        pieceAt[square] = code;
        hashKey ^= ZobristHashKeys.pieceSquare(code, square);
        if (pieceType == PieceUtils.KING) {
            kingSquare[color] = square;
        }
    }

    public void clearSquare(int square) {
        byte code = pieceAt[square];
        if (code == 0) return;
        hashKey ^= ZobristHashKeys.pieceSquare(code, square);
        pieceAt[square] = 0;
        int color = PieceUtils.toColor(code);
        if (PieceUtils.toPieceCode(code) == PieceUtils.KING && kingSquare[color] == square) {
            kingSquare[color] = -1;
        }
    }

    public void setHandCount(int color, int type, int count) {
        hashKey = ZobristHashKeys.changeHand(hashKey, color, type, hands[color][type], count);
        hands[color][type] = count;
    }

    public void playMove(int move, int color) {
        final int to = Move.getTo(move);
        final byte type = Move.getPieceType(move);

        if (Move.isDrop(move)) {
            byte code = PieceUtils.encode(type, color);
            pieceAt[to] = code;
            hashKey ^= ZobristHashKeys.pieceSquare(code, to);
            changeHand(color, type, -1);
            return;
        }

        final int from = Move.getFrom(move);
        final byte moving = pieceAt[from];
        pieceAt[from] = 0;
        hashKey ^= ZobristHashKeys.pieceSquare(moving, from);

        final byte captured = Move.getCaptured(move);
        if (captured != PieceUtils.NONE) {
            byte capturedCode = pieceAt[to];
            hashKey ^= ZobristHashKeys.pieceSquare(capturedCode, to);
            changeHand(color, PieceUtils.unpromote(captured), 1);
        }

        byte arriving = PieceUtils.encode(Move.getResultingType(move), color);
        pieceAt[to] = arriving;
        hashKey ^= ZobristHashKeys.pieceSquare(arriving, to);

        if (type == PieceUtils.KING) {
            kingSquare[color] = to;
        }
    }

    public void undoMove(int move, int color) {
        final int to = Move.getTo(move);
        final byte type = Move.getPieceType(move);
        final byte arrived = pieceAt[to];
        hashKey ^= ZobristHashKeys.pieceSquare(arrived, to);

        if (Move.isDrop(move)) {
            pieceAt[to] = 0;
            changeHand(color, type, 1);
            return;
        }

        final int from = Move.getFrom(move);
        byte moving = PieceUtils.encode(type, color);
        pieceAt[from] = moving;
        hashKey ^= ZobristHashKeys.pieceSquare(moving, from);

        final byte captured = Move.getCaptured(move);
        if (captured != PieceUtils.NONE) {
            byte capturedCode = PieceUtils.encode(captured, ColorUtils.switchColor(color));
            pieceAt[to] = capturedCode;
            hashKey ^= ZobristHashKeys.pieceSquare(capturedCode, to);
            changeHand(color, PieceUtils.unpromote(captured), -1);
        } else {
            pieceAt[to] = 0;
        }

        if (type == PieceUtils.KING) {
            kingSquare[color] = from;
        }
    }

    private void changeHand(int color, int type, int delta) {
        int count = hands[color][type];
        hashKey = ZobristHashKeys.changeHand(hashKey, color, type, count, count + delta);
        hands[color][type] = count + delta;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return Arrays.equals(pieceAt, other.pieceAt)
                && Arrays.equals(hands[0], other.hands[0])
                && Arrays.equals(hands[1], other.hands[1])
                && Arrays.equals(kingSquare, other.kingSquare)
                && hashKey == other.hashKey;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(hashKey);
    }

    public String print() {
        StringBuilder sb = new StringBuilder();
        for (int rank = 1; rank <= SquareUtils.SIZE; rank++) {
            for (int file = SquareUtils.SIZE; file >= 1; file--) {
                byte code = pieceAt[SquareUtils.square(file, rank)];
                if (code == 0) {
                    sb.append(" . ");
                } else {
                    boolean black = ColorUtils.isBlack(PieceUtils.toColor(code));
                    String sfen = PieceUtils.toPieceType(code).toSfen(black);
                    sb.append(sfen.length() == 1 ? " " + sfen + " " : sfen + " ");
                }
            }
            sb.append(' ').append((char) ('a' + rank - 1)).append('\n');
        }
        return sb.toString();
    }
}
