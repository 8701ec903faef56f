package max.shogi.engine.movegen;

import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.notations.MoveIOUtils;

/**
 * Moves are packed in an int:
 * <pre>
 * bits  0-6  : destination square
 * bits  7-13 : origin square (0 for drops)
 * bits 14-17 : piece type moved or dropped, before promotion
 * bit  18    : promotion
 * bit  19    : drop
 * bits 20-23 : captured piece type as it stood on the board (0 when nothing is captured)
 * </pre>
 * {@link #NONE} (0) is never a real move since a drop always has its flag set and a board move
 * always carries a piece type.
 */
public record Move(int from, int to, byte pieceType, boolean promote, boolean drop, byte captured) {
    public static final int NONE = 0;

    private static final int SQUARE_MASK = 0b1111111;
    private static final int FROM_SHIFT = 7;
    private static final int PIECE_SHIFT = 14;
    private static final int PROMOTE_FLAG = 1 << 18;
    private static final int DROP_FLAG = 1 << 19;
    private static final int CAPTURED_SHIFT = 20;

    // Don't build a Move object if you're on the hotpath, rely on the static below instead
    @Deprecated
    public Move {
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeUsi(toBytes());
    }

    @Deprecated
    public static Move fromBytes(final int bytes) {
        return new Move(getFrom(bytes), getTo(bytes), getPieceType(bytes), isPromotion(bytes), isDrop(bytes), getCaptured(bytes));
    }

    public int toBytes() {
        return drop ? asDrop(to, pieceType) : asBytes(from, to, pieceType, captured, promote);
    }

    public static int asBytes(final int from, final int to, final int pieceType, final int captured, final boolean promote) {
        int move = (captured << CAPTURED_SHIFT) | (pieceType << PIECE_SHIFT) | (from << FROM_SHIFT) | to;
        return promote ? move | PROMOTE_FLAG : move;
    }

    public static int asBytes(final int from, final int to, final int pieceType, final int captured) {
        return asBytes(from, to, pieceType, captured, false);
    }

    public static int asDrop(final int to, final int pieceType) {
        return DROP_FLAG | (pieceType << PIECE_SHIFT) | to;
    }

    public static int getTo(final int bytes) {
        return bytes & SQUARE_MASK;
    }

    public static int getFrom(final int bytes) {
        return (bytes >>> FROM_SHIFT) & SQUARE_MASK;
    }

    public static byte getPieceType(final int bytes) {
        return (byte) ((bytes >>> PIECE_SHIFT) & 0b1111);
    }

    public static byte getCaptured(final int bytes) {
        return (byte) ((bytes >>> CAPTURED_SHIFT) & 0b1111);
    }

    public static boolean isPromotion(final int bytes) {
        return (bytes & PROMOTE_FLAG) != 0;
    }

    public static boolean isDrop(final int bytes) {
        return (bytes & DROP_FLAG) != 0;
    }

    public static boolean isCapture(final int bytes) {
        return getCaptured(bytes) != PieceUtils.NONE;
    }

    // Type standing on the destination once the move is played
    public static byte getResultingType(final int bytes) {
        byte type = getPieceType(bytes);
        return isPromotion(bytes) ? PieceUtils.promote(type) : type;
    }
}
