package com.chessvision.server.vision;

public enum PieceColor {
    WHITE,
    BLACK
}
