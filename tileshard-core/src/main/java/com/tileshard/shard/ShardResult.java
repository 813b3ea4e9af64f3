package com.tileshard.shard;

import java.nio.file.Path;

/**
 * The output of one tile.
 *
 * @param index position of the tile in the grid
 * @param path  the shard file that was written
 * @param rows  number of points written, not counting the header
 */
public record ShardResult(int index, Path path, long rows) {}
