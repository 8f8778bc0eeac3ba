package com.autoposter.variation;

import lombok.Value;

import java.nio.file.Path;

@Value
public class HashCollision {
    String hash;
    Path first;
    Path second;
}
