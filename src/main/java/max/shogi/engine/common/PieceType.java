package max.shogi.engine.common;

import max.shogi.engine.utils.PieceUtils;

// Do not use it on the hotpath, only for convenience
@Deprecated
public enum PieceType {
    NONE(' ', false),
    PAWN('P', false), LANCE('L', false), KNIGHT('N', false), SILVER('S', false),
    BISHOP('B', false), ROOK('R', false), GOLD('G', false), KING('K', false),
    PRO_PAWN('P', true), PRO_LANCE('L', true), PRO_KNIGHT('N', true), PRO_SILVER('S', true),
    HORSE('B', true), DRAGON('R', true);

    public static final PieceType[] VALUES = PieceType.values();

    // SFEN letter of the unpromoted piece, uppercase
    public final char letter;
    public final boolean promoted;

    PieceType(char letter, boolean promoted) {
        this.letter = letter;
        this.promoted = promoted;
    }

    public byte toBytes() {
        return (byte) ordinal();
    }

    public String toSfen(boolean black) {
        char c = black ? letter : Character.toLowerCase(letter);
        return promoted ? "+" + c : String.valueOf(c);
    }

    public static PieceType fromLetter(char letter, boolean promoted) {
        byte base = switch (Character.toUpperCase(letter)) {
            case 'P' -> PieceUtils.PAWN;
            case 'L' -> PieceUtils.LANCE;
            case 'N' -> PieceUtils.KNIGHT;
            case 'S' -> PieceUtils.SILVER;
            case 'B' -> PieceUtils.BISHOP;
            case 'R' -> PieceUtils.ROOK;
            case 'G' -> PieceUtils.GOLD;
            case 'K' -> PieceUtils.KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
        if (promoted) {
            if (!PieceUtils.canPromote(base)) {
                throw new IllegalArgumentException("Piece " + letter + " cannot be promoted");
            }
            base = PieceUtils.promote(base);
        }
        return VALUES[base];
    }
}
