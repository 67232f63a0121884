package com.edge.match.core.team;

public enum ColorSpace {
    RGB,
    HSV
}
