package io.trello.client.net;

public enum HttpMethod {
    GET(false),
    POST(true),
    PUT(true),
    DELETE(true);

    private final boolean write;

    HttpMethod(boolean write) {
        this.write = write;
    }

    /**
     * @return true for methods that change state on the server
     */
    public boolean isWrite() {
        return write;
    }
}
