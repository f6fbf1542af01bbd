package com.chessvision.server.vision;

/**
 * The twelve coloured pieces plus the empty square.
 * The symbol is the placement-string character ('.' for empty).
 */
public enum PieceType {
    WHITE_PAWN('P', PieceKind.PAWN, PieceColor.WHITE),
    WHITE_KNIGHT('N', PieceKind.KNIGHT, PieceColor.WHITE),
    WHITE_BISHOP('B', PieceKind.BISHOP, PieceColor.WHITE),
    WHITE_ROOK('R', PieceKind.ROOK, PieceColor.WHITE),
    WHITE_QUEEN('Q', PieceKind.QUEEN, PieceColor.WHITE),
    WHITE_KING('K', PieceKind.KING, PieceColor.WHITE),
    BLACK_PAWN('p', PieceKind.PAWN, PieceColor.BLACK),
    BLACK_KNIGHT('n', PieceKind.KNIGHT, PieceColor.BLACK),
    BLACK_BISHOP('b', PieceKind.BISHOP, PieceColor.BLACK),
    BLACK_ROOK('r', PieceKind.ROOK, PieceColor.BLACK),
    BLACK_QUEEN('q', PieceKind.QUEEN, PieceColor.BLACK),
    BLACK_KING('k', PieceKind.KING, PieceColor.BLACK),
    EMPTY('.', null, null);

    private final char symbol;
    private final PieceKind kind;
    private final PieceColor color;

    PieceType(char symbol, PieceKind kind, PieceColor color) {
        this.symbol = symbol;
        this.kind = kind;
        this.color = color;
    }

    public char getSymbol() {
        return symbol;
    }

    /**
     * @return the piece kind, or null for {@link #EMPTY}
     */
    public PieceKind getKind() {
        return kind;
    }

    /**
     * @return the piece colour, or null for {@link #EMPTY}
     */
    public PieceColor getColor() {
        return color;
    }

    public static PieceType of(PieceKind kind, PieceColor color) {
        for (PieceType t : values()) {
            if (t.kind == kind && t.color == color) {
                return t;
            }
        }
        throw new IllegalArgumentException("No piece for " + kind + "/" + color);
    }
}
