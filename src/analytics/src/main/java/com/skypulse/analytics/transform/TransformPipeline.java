package com.skypulse.analytics.transform;

/** Raw {@code /states/all} body in, normalized flight records out. */
public class TransformPipeline {
  private final StateVectorParser parser;
  private final FlightTransformer transformer;

  public TransformPipeline(StateVectorParser parser, FlightTransformer transformer) {
    this.parser = parser;
    this.transformer = transformer;
  }

  /**
   * Transforms one raw payload.
   *
   * @param rawPayload upstream response body
   * @return records plus row accounting
   * @throws MalformedPayloadException when the body is not a JSON object
   */
  public TransformResult transform(String rawPayload) {
    return transformer.transform(parser.parse(rawPayload));
  }
}
