package im.arun.docoutline.ranking;

import java.util.List;

/**
 * Sentence embedding model. Vectors are returned in input order.
 */
public interface EmbeddingClient {

    List<double[]> embed(List<String> texts) throws EmbeddingException;
}
