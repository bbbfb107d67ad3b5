package com.signaldesk.pipeline.fetch;

import java.io.IOException;

public interface HttpTransport {
    TransportResponse execute(FetchRequest request) throws IOException, InterruptedException;
}
