package im.arun.planindex.block;

import im.arun.planindex.model.SyntheticBlock;
import lombok.Value;

import java.util.List;

@Value
public class BlockResult {
    List<SyntheticBlock> blocks;
    AdapterMetrics metrics;
}
