package com.questrail.brickhub.protocol.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Which upstream messages answer which synchronous commands.
 */
final class ReplyCorrelationTest
{
    @Test
    void propertyUpdateAnswersRequestForSameProperty()
    {
        HubProperties request = HubProperties.request(HubProperties.VOLTAGE_PERCENT);

        assertTrue(request.needsReply());
        assertTrue(HubProperties.update(HubProperties.VOLTAGE_PERCENT, new byte[] { 1 }).isReplyTo(request));
        assertFalse(HubProperties.update(HubProperties.ADVERTISE_NAME, new byte[] { 1 }).isReplyTo(request));
        assertFalse(new HubProperties(HubProperties.VOLTAGE_PERCENT, HubProperties.SET, null).isReplyTo(request));
    }

    @Test
    void onlyRequestUpdatePropertiesNeedReply()
    {
        assertFalse(new HubProperties(HubProperties.BUTTON, HubProperties.ENABLE_UPDATES, null).needsReply());
        assertFalse(new HubProperties(HubProperties.BUTTON, HubProperties.DISABLE_UPDATES, null).needsReply());
    }

    @Test
    void hubActionAcknowledgements()
    {
        HubAction switchOff = new HubAction(HubAction.SWITCH_OFF);
        HubAction disconnect = new HubAction(HubAction.DISCONNECT);

        assertTrue(new HubAction(HubAction.UPSTREAM_SHUTDOWN).isReplyTo(switchOff));
        assertFalse(new HubAction(HubAction.UPSTREAM_DISCONNECT).isReplyTo(switchOff));
        assertTrue(new HubAction(HubAction.UPSTREAM_DISCONNECT).isReplyTo(disconnect));
        assertFalse(new HubAction(HubAction.UPSTREAM_BOOT_MODE).isReplyTo(disconnect));
        assertFalse(new HubAction(HubAction.BUSY_INDICATION_ON).needsReply());
    }

    @Test
    void alertUpdateAnswersRequestForSameAlert()
    {
        HubAlert request = HubAlert.request(HubAlert.LOW_VOLTAGE);

        assertTrue(HubAlert.update(HubAlert.LOW_VOLTAGE, HubAlert.STATUS_OK).isReplyTo(request));
        assertFalse(HubAlert.update(HubAlert.HIGH_CURRENT, HubAlert.STATUS_OK).isReplyTo(request));
    }

    @Test
    void genericErrorAnswersCommandOfSameType()
    {
        GenericError error = new GenericError(HubProperties.TYPE, GenericError.COMMAND_NOT_RECOGNIZED);

        assertTrue(error.isReplyTo(HubProperties.request(HubProperties.PRIMARY_MAC)));
        assertFalse(error.isReplyTo(new HubAction(HubAction.DISCONNECT)));
    }

    @Test
    void inputFormatAnswersSetupForSamePort()
    {
        PortInputFormatSetupSingle setup = new PortInputFormatSetupSingle(0x3A, 0, 1, true);

        assertTrue(new PortInputFormatSingle(0x3A, 0, 1, true).isReplyTo(setup));
        assertFalse(new PortInputFormatSingle(0x3B, 0, 1, true).isReplyTo(setup));
    }

    @Test
    void outputFeedbackAnswersOnlyWhenCommandFinished()
    {
        PortOutput output = new PortOutput(0x00, PortOutput.COMPLETION_FEEDBACK, PortOutput.SUBCMD_START_POWER,
                new byte[] { 0x10 });

        assertTrue(new PortOutputFeedback(0x00, PortOutputFeedback.COMPLETED).isReplyTo(output));
        assertTrue(new PortOutputFeedback(0x00, PortOutputFeedback.DISCARDED).isReplyTo(output));
        assertFalse(new PortOutputFeedback(0x00, PortOutputFeedback.IN_PROGRESS).isReplyTo(output));
        assertFalse(new PortOutputFeedback(0x01, PortOutputFeedback.COMPLETED).isReplyTo(output));
    }

    @Test
    void notificationsAreNotRepliesByDefault()
    {
        HubProperties request = HubProperties.request(HubProperties.VOLTAGE_PERCENT);

        assertFalse(HubAttachedIo.detached(0x00).isReplyTo(request));
        assertFalse(new PortValueSingle(0x00, new byte[0]).isReplyTo(request));
    }

    @Test
    void attachmentEventsValidateTheirShape()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new HubAttachedIo(0x00, 0x05, 0, 0, 0, null));
        assertThrows(IllegalArgumentException.class,
                () -> new HubAttachedIo(0x10, HubAttachedIo.EVENT_ATTACHED_VIRTUAL, 0x27, 0, 0, null));
        assertThrows(IllegalArgumentException.class, () -> new VirtualPorts(0x01, 0x01));
    }
}
