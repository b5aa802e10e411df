package ch.uzh.ifi.scoring.model.dao;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

@Data
@AllArgsConstructor
public class MaxScores {
    Double maxScore;
    Double maxPublicScore;
    List<String> rankingHeaders;
}
