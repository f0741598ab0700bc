package in.papertick.transport.ws;

import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.xnio.IoUtils;

import java.io.IOException;

/**
 * {@link ClientTransport} over an Undertow WebSocket channel.
 */
final class UndertowClientTransport implements ClientTransport {
    private final WebSocketChannel channel;

    UndertowClientTransport(WebSocketChannel channel) {
        this.channel = channel;
    }

    @Override
    public void send(String text) throws IOException {
        if (!channel.isOpen()) {
            throw new IOException("Channel closed");
        }
        WebSockets.sendTextBlocking(text, channel);
    }

    @Override
    public void close(int code, String reason) {
        if (!channel.isOpen()) {
            return;
        }
        if (code == CloseCodes.ABNORMAL) {
            // 1006 never goes on the wire
            abort();
        } else {
            WebSockets.sendClose(code, reason, channel, new WebSocketCallback<Void>() {
                @Override
                public void complete(WebSocketChannel ch, Void context) {
                    IoUtils.safeClose(ch);
                }

                @Override
                public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                    IoUtils.safeClose(ch);
                }
            });
        }
    }

    @Override
    public void abort() {
        IoUtils.safeClose(channel);
    }

    @Override
    public String remoteAddress() {
        return String.valueOf(channel.getSourceAddress());
    }
}
