package max.shogi.engine.utils;

import max.shogi.engine.common.PieceType;

public final class PieceUtils {
    // 5th bit is the color, lower 4 bits the piece type
    private static final byte COLOR_MASK = 0b10000;
    private static final byte PIECE_TYPE_MASK = 0b01111;
    private static final int PROMOTION_OFFSET = 8;

    public static final byte NONE = 0;
    public static final byte PAWN = 1;
    public static final byte LANCE = 2;
    public static final byte KNIGHT = 3;
    public static final byte SILVER = 4;
    public static final byte BISHOP = 5;
    public static final byte ROOK = 6;
    public static final byte GOLD = 7;
    public static final byte KING = 8;
    public static final byte PRO_PAWN = 9;
    public static final byte PRO_LANCE = 10;
    public static final byte PRO_KNIGHT = 11;
    public static final byte PRO_SILVER = 12;
    public static final byte HORSE = 13;
    public static final byte DRAGON = 14;

    // Pieces that can be held in hand, in drop generation order
    public static final byte[] HAND_TYPES = {ROOK, BISHOP, GOLD, SILVER, KNIGHT, LANCE, PAWN};

    // Rough material values, only used for move ordering
    private static final int[] VALUES = {0, 1, 3, 4, 5, 8, 10, 6, 0, 6, 6, 6, 6, 10, 12};

    static final PieceType[] FROM_CODE = {
            PieceType.NONE, PieceType.PAWN, PieceType.LANCE, PieceType.KNIGHT, PieceType.SILVER,
            PieceType.BISHOP, PieceType.ROOK, PieceType.GOLD, PieceType.KING,
            PieceType.PRO_PAWN, PieceType.PRO_LANCE, PieceType.PRO_KNIGHT, PieceType.PRO_SILVER,
            PieceType.HORSE, PieceType.DRAGON
    };

    private PieceUtils() {}

    public static PieceType toPieceType(int code) { return FROM_CODE[code & PIECE_TYPE_MASK]; }
    public static byte toPieceCode(int code) { return (byte) (code & PIECE_TYPE_MASK); }
    public static int toColor(int code) { return (code & COLOR_MASK) >>> 4; }

    public static byte encode(int pieceType, int color) {
        return (byte) (color << 4 | pieceType);
    }

    public static boolean isEmpty(int code) {
        return code == 0;
    }

    public static boolean isPromoted(int pieceType) {
        return pieceType > KING;
    }

    public static boolean canPromote(int pieceType) {
        return pieceType >= PAWN && pieceType <= ROOK;
    }

    public static byte promote(int pieceType) {
        return (byte) (pieceType + PROMOTION_OFFSET);
    }

    public static byte unpromote(int pieceType) {
        return isPromoted(pieceType) ? (byte) (pieceType - PROMOTION_OFFSET) : (byte) pieceType;
    }

    public static int value(int pieceType) {
        return VALUES[pieceType];
    }
}
