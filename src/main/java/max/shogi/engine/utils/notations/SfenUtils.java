package max.shogi.engine.utils.notations;

import max.shogi.engine.common.PieceType;
import max.shogi.engine.game.Game;
import max.shogi.engine.game.InvalidPositionException;
import max.shogi.engine.game.board.Board;
import max.shogi.engine.utils.ColorUtils;
import max.shogi.engine.utils.PieceUtils;
import max.shogi.engine.utils.SquareUtils;

// https://shogidokoro2.stars.ne.jp/usi.html (SFEN section)
public final class SfenUtils {
    private SfenUtils() {}

    public static Game getGameFrom(String sfen) {
        String[] fields = sfen.trim().split("\\s+");
        if (fields.length < 3 || fields.length > 4) {
            throw new InvalidPositionException("Invalid SFEN record: " + sfen);
        }

        Game game = new Game();
        injectBoard(game.board(), fields[0]);
        injectCurrentTurn(game, fields[1]);
        injectHands(game.board(), fields[2]);
        if (fields.length == 4) {
            try {
                game.moveNumber = Integer.parseInt(fields[3]);
            } catch (NumberFormatException e) {
                throw new InvalidPositionException("Invalid SFEN move number: " + fields[3], e);
            }
        }
        return game;
    }

    public static String getSfenFromGame(Game game) {
        StringBuilder sfen = new StringBuilder();
        writeBoard(game.board(), sfen);
        sfen.append(' ').append(ColorUtils.isBlack(game.currentPlayer) ? 'b' : 'w');
        sfen.append(' ');
        writeHands(game.board(), sfen);
        sfen.append(' ').append(game.moveNumber);
        return sfen.toString();
    }

    private static void injectBoard(Board board, String placement) {
        String[] ranks = placement.split("/");
        if (ranks.length != SquareUtils.SIZE) {
            throw new InvalidPositionException("SFEN board should have 9 ranks: " + placement);
        }
        for (int rank = 1; rank <= SquareUtils.SIZE; rank++) {
            String row = ranks[rank - 1];
            int file = SquareUtils.SIZE;
            boolean promoted = false;
            for (char c : row.toCharArray()) {
                if (c == '+') {
                    promoted = true;
                    continue;
                }
                if (Character.isDigit(c)) {
                    if (promoted) {
                        throw new InvalidPositionException("Promotion mark on empty squares: " + row);
                    }
                    file -= c - '0';
                    continue;
                }
                if (file < 1) {
                    throw new InvalidPositionException("Too many squares on rank " + rank + ": " + row);
                }
                PieceType pieceType = parsePiece(c, promoted);
                int color = Character.isUpperCase(c) ? ColorUtils.BLACK : ColorUtils.WHITE;
                board.setPiece(SquareUtils.square(file, rank), pieceType.toBytes(), color);
                promoted = false;
                file--;
            }
            if (file != 0 || promoted) {
                throw new InvalidPositionException("Rank " + rank + " does not describe 9 squares: " + row);
            }
        }
    }

    private static PieceType parsePiece(char c, boolean promoted) {
        try {
            return PieceType.fromLetter(c, promoted);
        } catch (IllegalArgumentException e) {
            throw new InvalidPositionException("Invalid SFEN piece " + (promoted ? "+" : "") + c, e);
        }
    }

    private static void injectCurrentTurn(Game game, String turn) {
        switch (turn) {
            case "b" -> game.setCurrentPlayer(ColorUtils.BLACK);
            case "w" -> game.setCurrentPlayer(ColorUtils.WHITE);
            default -> throw new InvalidPositionException("SFEN side to move should be 'b' or 'w': " + turn);
        }
    }

    private static void injectHands(Board board, String hands) {
        if (hands.equals("-")) {
            return;
        }
        int count = 0;
        for (char c : hands.toCharArray()) {
            if (Character.isDigit(c)) {
                count = count * 10 + (c - '0');
                continue;
            }
            PieceType pieceType = parsePiece(c, false);
            byte type = pieceType.toBytes();
            if (type == PieceUtils.KING) {
                throw new InvalidPositionException("A king cannot be held in hand");
            }
            int color = Character.isUpperCase(c) ? ColorUtils.BLACK : ColorUtils.WHITE;
            int total = board.handCount(color, type) + (count == 0 ? 1 : count);
            if (total > Game.maxInHand(type)) {
                throw new InvalidPositionException("Too many " + pieceType + " in hand: " + total);
            }
            board.setHandCount(color, type, total);
            count = 0;
        }
        if (count != 0) {
            throw new InvalidPositionException("Dangling count in SFEN hands: " + hands);
        }
    }

    private static void writeBoard(Board board, StringBuilder sfen) {
        for (int rank = 1; rank <= SquareUtils.SIZE; rank++) {
            if (rank != 1) {
                sfen.append('/');
            }
            int empty = 0;
            for (int file = SquareUtils.SIZE; file >= 1; file--) {
                byte code = board.getPieceAt(SquareUtils.square(file, rank));
                if (PieceUtils.isEmpty(code)) {
                    empty++;
                    continue;
                }
                if (empty != 0) {
                    sfen.append(empty);
                    empty = 0;
                }
                sfen.append(PieceUtils.toPieceType(code).toSfen(ColorUtils.isBlack(PieceUtils.toColor(code))));
            }
            if (empty != 0) {
                sfen.append(empty);
            }
        }
    }

    private static void writeHands(Board board, StringBuilder sfen) {
        int start = sfen.length();
        for (int color = 0; color < 2; color++) {
            for (byte type : PieceUtils.HAND_TYPES) {
                int count = board.handCount(color, type);
                if (count == 0) continue;
                if (count > 1) {
                    sfen.append(count);
                }
                sfen.append(PieceUtils.toPieceType(type).toSfen(ColorUtils.isBlack(color)));
            }
        }
        if (sfen.length() == start) {
            sfen.append('-');
        }
    }
}
