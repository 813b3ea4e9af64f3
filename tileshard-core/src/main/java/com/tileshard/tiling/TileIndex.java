package com.tileshard.tiling;

/** Column {@code ix} and row {@code iy} of a tile within a {@link GridTiler}. */
public record TileIndex(int ix, int iy) {}
