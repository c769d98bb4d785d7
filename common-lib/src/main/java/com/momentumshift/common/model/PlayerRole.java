package com.momentumshift.common.model;

public enum PlayerRole {
    BATTER,
    PITCHER,
    FIELDER
}
