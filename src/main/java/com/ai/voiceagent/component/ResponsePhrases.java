package com.ai.voiceagent.component;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reply templates for the rule-based path and the phone prompts. Kept short and plain so they read
 * well through text-to-speech.
 */
@Component
public class ResponsePhrases {

    public static final String NO_INPUT = "I didn't catch that. Could you please repeat?";

    public static final String CONNECTION_TROUBLE = "I'm having trouble connecting to AI. Please try again.";

    private final String agentName;

    public ResponsePhrases(@Value("${agent.name:Aria}") String agentName) {
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }

    public List<String> greetings() {
        return List.of(
                "Hello! How can I help you today?",
                "Hi there! What can I do for you?",
                "Hey! Great to hear from you. What's on your mind?",
                "Greetings! How may I assist you?"
        );
    }

    public String identity() {
        return "I'm " + agentName + ", your voice assistant. I can chat, tell the time and date, share a joke, and answer simple questions.";
    }

    public String time(String formattedTime) {
        return "It's currently " + formattedTime + ".";
    }

    public String date(String formattedDate) {
        return "Today is " + formattedDate + ".";
    }

    public List<String> wellbeing() {
        return List.of(
                "I'm doing great, thanks for asking! How about you?",
                "All systems running smoothly. How are you doing?",
                "I'm good! Ready to help. How are you?"
        );
    }

    public String weather() {
        return "I can't check live weather right now, but a quick look outside or at a weather app will tell you.";
    }

    public List<String> jokes() {
        return List.of(
                "Why don't scientists trust atoms? Because they make up everything!",
                "Why did the computer go to the doctor? It had a virus.",
                "I told my phone a joke about networking. It didn't get the connection.",
                "Why do programmers prefer dark mode? Because light attracts bugs."
        );
    }

    public String help() {
        return "I can chat with you, tell you the time or date, share a joke, and answer simple questions. Just ask!";
    }

    public List<String> thanks() {
        return List.of(
                "You're welcome!",
                "Happy to help!",
                "Anytime!",
                "No problem at all!"
        );
    }

    public String farewell() {
        return "Goodbye! It was nice talking to you.";
    }

    public String lifeMeaning() {
        return "Some say it's 42. I think it's about connection, curiosity, and being kind.";
    }

    public List<String> compliments() {
        return List.of(
                "Thank you, that's very kind of you!",
                "Aw, thanks! You're pretty great yourself.",
                "That made my day. Thank you!"
        );
    }

    public String questionWhat(String topic) {
        return "Good question about " + topic + ". I'd need my full AI brain online to answer that properly, but I'm happy to keep chatting.";
    }

    public String questionWhatFavorite() {
        return "I don't really have favorites, but I'd love to hear yours!";
    }

    public String questionHowWorks() {
        return "Under the hood it's a mix of rules and patterns. Happy to walk through the basics if you like.";
    }

    public String questionHowOld() {
        return "I'm as old as this conversation. Practically brand new!";
    }

    public String questionHow() {
        return "That depends on a few things. Could you tell me a bit more about what you're trying to do?";
    }

    public String questionWhy() {
        return "That's a deep question. There's usually more than one reason, but I'd love to hear what you think.";
    }

    public String questionWhen() {
        return "I'm not sure about the exact timing. Could you give me a bit more context?";
    }

    public String questionWhereYou() {
        return "I live in the cloud, so I'm wherever you need me.";
    }

    public String questionWhere() {
        return "I can't look up locations right now, but a map app would be a good place to start.";
    }

    public String questionWhoMadeYou() {
        return "I was built by a small team of developers who wanted a friendly voice assistant.";
    }

    public String questionWho() {
        return "I'm not sure who that is. Could you tell me more?";
    }

    public List<String> genericQuestion() {
        return List.of(
                "That's an interesting question. Let me think about that.",
                "Hmm, good question! I'm not completely sure, but I'm happy to talk it through.",
                "I don't have a definite answer for that one. What do you think?"
        );
    }

    public List<String> fallback(String firstToken) {
        return List.of(
                "Interesting! Tell me more about " + firstToken + ".",
                "I heard you mention " + firstToken + ". Could you elaborate?",
                "Hmm, " + firstToken + "? Say a little more about that."
        );
    }

    public String phoneGreeting() {
        return "Hello! Welcome to " + agentName + ". How can I help you today?";
    }

    public String outboundGreeting() {
        return "Hello! This is " + agentName + " calling. How can I assist you today?";
    }

    public String didNotHearAnything() {
        return "I didn't hear anything. Please try again.";
    }

    public String anythingElse() {
        return "Is there anything else I can help with?";
    }

    public String phoneFarewell() {
        return "Thank you for calling " + agentName + ". Goodbye!";
    }

    public String outboundNoResponse() {
        return "I didn't hear a response. Goodbye!";
    }

    public String phoneApology() {
        return "Sorry, something went wrong on our end. Please call again later. Goodbye!";
    }
}
