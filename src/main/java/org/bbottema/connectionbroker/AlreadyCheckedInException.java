package org.bbottema.connectionbroker;

import org.jetbrains.annotations.NotNull;

public class AlreadyCheckedInException extends InvalidHandleException {
	
	AlreadyCheckedInException(@NotNull CheckoutHandle<?> handle) {
		super("Handle " + handle + " has already been checked in");
	}
}
