package com.example.affairsdigest.service.docs;

public enum BulletPreset {
    BULLET_DISC_CIRCLE_SQUARE,
    NUMBERED_DECIMAL_ALPHA_ROMAN
}
